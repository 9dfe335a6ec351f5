package com.fareradar.client.model;

/** Pick-up or drop-off point of a car rental. */
public sealed interface RentalPlace permits LocationRef, Coordinates, AirportRef {}
