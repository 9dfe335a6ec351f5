package com.fareradar.client.model;

/** Leg date: a concrete calendar date or a flexible marker. */
public sealed interface TravelDate permits CalendarDate, SpecialMarker {}
