package com.fareradar.client.rental;

import com.fareradar.client.error.SearchValidationException;
import com.fareradar.client.model.CarRentalListing;
import com.fareradar.client.model.LocationRef;
import com.fareradar.client.model.RentalPlace;
import com.fareradar.client.search.SearchPreconditions;
import com.fareradar.client.search.SearchRequestFactory;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class CarRentalService {
  private static final Logger log = LoggerFactory.getLogger(CarRentalService.class);
  private static final int DRIVER_AGE_THRESHOLD = 25;

  // Segment positions in https://host/g/carhire-quotes/GB/en-GB/GBP/30/27544008/27544008/2025-07-01T10:00/2025-08-01T10:00/
  private static final int MIN_URL_SEGMENTS = 14;
  private static final int DRIVER_AGE_SEGMENT = 8;
  private static final int ORIGIN_SEGMENT = 9;
  private static final int DESTINATION_SEGMENT = 10;
  private static final int PICK_UP_SEGMENT = 11;
  private static final int DROP_OFF_SEGMENT = 12;

  private final SearchRequestFactory requestFactory;
  private final CarRentalPoller poller;
  private final Clock clock;

  public CarRentalService(SearchRequestFactory requestFactory, CarRentalPoller poller, Clock clock) {
    this.requestFactory = requestFactory;
    this.poller = poller;
    this.clock = clock;
  }

  /**
   * Searches car rentals; {@code destination} defaults to the pick-up place.
   */
  public CarRentalListing search(
      RentalPlace origin,
      LocalDateTime departTime,
      LocalDateTime returnTime,
      RentalPlace destination,
      boolean driverOver25) {
    if (origin == null || departTime == null || returnTime == null) {
      throw new SearchValidationException("Origin, depart time and return time are required");
    }
    RentalPlace dropOff = destination == null ? origin : destination;
    SearchPreconditions.checkRentalTimes(departTime, returnTime, LocalDateTime.now(clock));

    CarRentalQuery query =
        requestFactory.buildCarRentalQuery(origin, dropOff, departTime, returnTime, driverOver25);
    log.info("Starting car-rental search {} -> {} from {} to {}",
        query.originKey(), query.destinationKey(), query.pickUpTime(), query.dropOffTime());
    return poller.poll(query);
  }

  /** Runs the search encoded in a car-hire deep link. */
  public CarRentalListing searchFromUrl(String url) {
    if (url == null) {
      throw new SearchValidationException("URL not valid");
    }
    String[] segments = url.split("\\?", 2)[0].split("/", -1);
    if (segments.length < MIN_URL_SEGMENTS) {
      throw new SearchValidationException("URL not valid: " + url);
    }
    try {
      boolean driverOver25 = Integer.parseInt(segments[DRIVER_AGE_SEGMENT]) >= DRIVER_AGE_THRESHOLD;
      LocationRef origin = LocationRef.ofEntityId(segments[ORIGIN_SEGMENT]);
      LocationRef destination = LocationRef.ofEntityId(segments[DESTINATION_SEGMENT]);
      LocalDateTime departTime = LocalDateTime.parse(segments[PICK_UP_SEGMENT]);
      LocalDateTime returnTime = LocalDateTime.parse(segments[DROP_OFF_SEGMENT]);
      return search(origin, departTime, returnTime, destination, driverOver25);
    } catch (NumberFormatException | DateTimeParseException ex) {
      throw new SearchValidationException("URL not valid: " + url, ex);
    }
  }
}
