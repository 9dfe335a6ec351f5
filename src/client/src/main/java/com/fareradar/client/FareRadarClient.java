package com.fareradar.client;

import com.fareradar.client.model.AirportRef;
import com.fareradar.client.model.CabinClass;
import com.fareradar.client.model.CarRentalListing;
import com.fareradar.client.model.FlightPlace;
import com.fareradar.client.model.LocationRef;
import com.fareradar.client.model.RentalPlace;
import com.fareradar.client.model.SearchResult;
import com.fareradar.client.model.TravelDate;
import com.fareradar.client.rental.CarRentalService;
import com.fareradar.client.search.FlightSearchController;
import com.fareradar.client.search.ItineraryDetailsService;
import com.fareradar.client.suggest.PlaceSuggestService;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Single entry point over the flight, itinerary, car-rental and lookup operations.
 *
 * <p>Safe for concurrent use: every operation keeps its state on the calling thread.
 */
@Component
public class FareRadarClient {
  private final FlightSearchController flightSearch;
  private final ItineraryDetailsService itineraryDetails;
  private final CarRentalService carRental;
  private final PlaceSuggestService places;

  public FareRadarClient(
      FlightSearchController flightSearch,
      ItineraryDetailsService itineraryDetails,
      CarRentalService carRental,
      PlaceSuggestService places) {
    this.flightSearch = flightSearch;
    this.itineraryDetails = itineraryDetails;
    this.carRental = carRental;
    this.places = places;
  }

  public SearchResult flightPrices(
      AirportRef origin,
      FlightPlace destination,
      TravelDate departDate,
      TravelDate returnDate,
      CabinClass cabinClass,
      int adults,
      List<Integer> childAges) {
    return flightSearch.search(origin, destination, departDate, returnDate, cabinClass, adults, childAges);
  }

  public JsonNode itineraryDetails(String itineraryId, SearchResult result) {
    return itineraryDetails.details(itineraryId, result);
  }

  public CarRentalListing carRental(
      RentalPlace origin,
      LocalDateTime departTime,
      LocalDateTime returnTime,
      RentalPlace destination,
      boolean driverOver25) {
    return carRental.search(origin, departTime, returnTime, destination, driverOver25);
  }

  public CarRentalListing carRentalFromUrl(String url) {
    return carRental.searchFromUrl(url);
  }

  public List<AirportRef> searchAirports(String query, LocalDate departDate, LocalDate returnDate) {
    return places.searchAirports(query, departDate, returnDate);
  }

  public AirportRef airportByCode(String airportCode) {
    return places.airportByCode(airportCode);
  }

  public List<LocationRef> searchLocations(String query) {
    return places.searchLocations(query);
  }
}
