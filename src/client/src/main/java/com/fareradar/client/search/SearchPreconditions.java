package com.fareradar.client.search;

import com.fareradar.client.error.SearchValidationException;
import com.fareradar.client.model.CabinClass;
import com.fareradar.client.model.CalendarDate;
import com.fareradar.client.model.FlightPlace;
import com.fareradar.client.model.SpecialMarker;
import com.fareradar.client.model.TravelDate;
import java.time.LocalDateTime;
import java.util.List;

/** Input checks run before any request leaves the client. */
public final class SearchPreconditions {
  public static final int MAX_ADULTS = 8;
  public static final int MAX_CHILDREN = 8;
  public static final int MAX_CHILD_AGE = 17;

  private SearchPreconditions() {}

  public static void checkPassengers(int adults, List<Integer> childAges) {
    if (adults < 1 || adults > MAX_ADULTS) {
      throw new SearchValidationException("Adults must be between 1 and " + MAX_ADULTS + ", got " + adults);
    }
    if (childAges.size() > MAX_CHILDREN) {
      throw new SearchValidationException("Max " + MAX_CHILDREN + " children, got " + childAges.size());
    }
    for (Integer age : childAges) {
      if (age == null || age < 0 || age > MAX_CHILD_AGE) {
        throw new SearchValidationException("Child ages must be >= 0 and <= " + MAX_CHILD_AGE + ", got " + age);
      }
    }
  }

  public static void checkFlightDates(TravelDate departDate, TravelDate returnDate, LocalDateTime now) {
    if (departDate instanceof CalendarDate depart
        && returnDate instanceof CalendarDate ret
        && ret.isBefore(depart)) {
      throw new SearchValidationException("Return date cannot be before departure");
    }
    CalendarDate today = CalendarDate.of(now);
    if (departDate instanceof CalendarDate depart && depart.isBefore(today)) {
      throw new SearchValidationException("Depart date cannot be in the past");
    }
    if (returnDate instanceof CalendarDate ret && ret.isBefore(today)) {
      throw new SearchValidationException("Return date cannot be in the past");
    }
  }

  /** Flexible searches only support the default cabin. */
  public static void checkCabin(
      CabinClass cabinClass, TravelDate departDate, TravelDate returnDate, FlightPlace destination) {
    if (cabinClass == CabinClass.ECONOMY) {
      return;
    }
    if (isFlexible(departDate) || isFlexible(returnDate) || isFlexible(destination)) {
      throw new SearchValidationException(
          "Cabin class " + cabinClass + " needs concrete depart date, return date and destination");
    }
  }

  public static void checkRentalTimes(LocalDateTime departTime, LocalDateTime returnTime, LocalDateTime now) {
    if (returnTime.isBefore(departTime)) {
      throw new SearchValidationException("Return time cannot be before depart time");
    }
    if (departTime.isBefore(now) || returnTime.isBefore(now)) {
      throw new SearchValidationException("Return or depart time cannot be in the past");
    }
  }

  private static boolean isFlexible(Object value) {
    return value instanceof SpecialMarker marker && marker.isFlexible();
  }
}
