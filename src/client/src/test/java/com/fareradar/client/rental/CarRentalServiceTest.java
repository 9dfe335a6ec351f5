package com.fareradar.client.rental;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fareradar.client.FareRadarFixtures;
import com.fareradar.client.error.SearchValidationException;
import com.fareradar.client.model.CarRentalListing;
import com.fareradar.client.model.Coordinates;
import com.fareradar.client.search.SearchRequestFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.LocalDateTime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CarRentalServiceTest {
  private static final LocalDateTime PICK_UP = LocalDateTime.of(2026, 7, 1, 10, 0);
  private static final LocalDateTime DROP_OFF = LocalDateTime.of(2026, 8, 1, 10, 0);

  @Mock private CarRentalPoller poller;

  private CarRentalService service;

  @BeforeEach
  void setUp() {
    service = new CarRentalService(new SearchRequestFactory(), poller, FareRadarFixtures.CLOCK);
  }

  @Test
  void dropOffDefaultsToPickUpPlace() {
    CarRentalListing listing = new CarRentalListing(new ObjectMapper().createObjectNode(), 4, 2);
    when(poller.poll(any(CarRentalQuery.class))).thenReturn(listing);

    CarRentalListing result = service.search(new Coordinates(45.63, 8.72), PICK_UP, DROP_OFF, null, true);

    assertThat(result).isSameAs(listing);
    ArgumentCaptor<CarRentalQuery> query = ArgumentCaptor.forClass(CarRentalQuery.class);
    verify(poller).poll(query.capture());
    assertThat(query.getValue().originKey()).isEqualTo("45.63,8.72");
    assertThat(query.getValue().destinationKey()).isEqualTo("45.63,8.72");
    assertThat(query.getValue().driverAge()).isEqualTo("30");
  }

  @Test
  void rejectsReturnBeforeDepart() {
    assertThatThrownBy(() -> service.search(FareRadarFixtures.ISTANBUL, DROP_OFF, PICK_UP, null, true))
        .isInstanceOf(SearchValidationException.class);
    verifyNoInteractions(poller);
  }

  @Test
  void rejectsPastTimes() {
    LocalDateTime past = LocalDateTime.of(2026, 2, 1, 10, 0);

    assertThatThrownBy(() -> service.search(FareRadarFixtures.ISTANBUL, past, DROP_OFF, null, true))
        .isInstanceOf(SearchValidationException.class)
        .hasMessageContaining("past");
    verifyNoInteractions(poller);
  }

  @Test
  void deepLinkIsParsedIntoQuery() {
    when(poller.poll(any(CarRentalQuery.class)))
        .thenReturn(new CarRentalListing(new ObjectMapper().createObjectNode(), 1, 2));

    service.searchFromUrl("https://www.skyscanner.net/g/carhire-quotes/GB/en-GB/GBP/22/27544008/27539793/"
        + "2026-07-01T10:00/2026-08-01T12:30/?group=true&sipp_map=true");

    ArgumentCaptor<CarRentalQuery> query = ArgumentCaptor.forClass(CarRentalQuery.class);
    verify(poller).poll(query.capture());
    assertThat(query.getValue()).isEqualTo(
        new CarRentalQuery("27544008", "27539793", "21", "2026-07-01T10:00", "2026-08-01T12:30", 0));
  }

  @Test
  void shortDeepLinkIsRejected() {
    assertThatThrownBy(() -> service.searchFromUrl("https://www.skyscanner.net/g/carhire-quotes/GB/en-GB/GBP/30/"))
        .isInstanceOf(SearchValidationException.class)
        .hasMessageContaining("URL not valid");
  }

  @Test
  void deepLinkWithBadDateIsRejected() {
    assertThatThrownBy(() -> service.searchFromUrl(
        "https://www.skyscanner.net/g/carhire-quotes/GB/en-GB/GBP/30/1/2/tomorrow/2026-08-01T10:00/"))
        .isInstanceOf(SearchValidationException.class);
    verifyNoInteractions(poller);
  }
}
