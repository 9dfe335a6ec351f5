package com.fareradar.client.rental;

/**
 * Car-rental listing request.
 *
 * @param originKey pick-up entity id or {@code "lat,lon"}
 * @param destinationKey drop-off entity id or {@code "lat,lon"}
 * @param driverAge age tier sent to the backend
 * @param pickUpTime backend-local pick-up time, {@code yyyy-MM-dd'T'HH:mm}
 * @param dropOffTime backend-local drop-off time, {@code yyyy-MM-dd'T'HH:mm}
 * @param requestSequence request counter, bumped on every poll
 */
public record CarRentalQuery(
    String originKey,
    String destinationKey,
    String driverAge,
    String pickUpTime,
    String dropOffTime,
    int requestSequence) {

  public CarRentalQuery nextRequest() {
    return new CarRentalQuery(
        originKey, destinationKey, driverAge, pickUpTime, dropOffTime, requestSequence + 1);
  }
}
