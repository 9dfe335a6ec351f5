package com.fareradar.client.model;

import com.fasterxml.jackson.databind.JsonNode;

/** Car-rental listing once its group count stopped changing between two polls. */
public record CarRentalListing(JsonNode json, int groupsCount, int requests) {}
