package com.fareradar.client.model;

/** Origin or destination of a flight leg: a concrete airport or a flexible marker. */
public sealed interface FlightPlace permits AirportRef, SpecialMarker {}
