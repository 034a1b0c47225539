package org.iplocation.server.location;

import org.iplocation.server.exception.DriverNotFoundException;
import org.iplocation.server.exception.FieldNotFoundException;
import org.iplocation.server.exception.InvalidAddressException;
import org.iplocation.server.exception.NoDriverAvailableException;
import org.iplocation.server.location.ip.ClientIpSources;
import org.iplocation.server.location.model.Location;
import org.iplocation.server.location.model.LocationContext;
import org.iplocation.server.location.model.RequestEnvironment;
import org.iplocation.server.session.InMemorySessionStore;
import org.iplocation.server.session.SessionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import static java.util.Arrays.asList;
import static java.util.Collections.emptyList;
import static java.util.Collections.singletonList;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
public class LocationResolverTest {

    private static final String NAMESPACE = "test.";
    private static final String IP = "66.102.0.0";

    @Mock
    private LocationDriver primaryDriver;
    @Mock
    private LocationDriver firstFallbackDriver;
    @Mock
    private LocationDriver secondFallbackDriver;

    private DriverFactory driverFactory;
    private IpAddressResolver ipAddressResolver;
    private CountryCodes countryCodes;

    private SessionStore session;
    private LocationContext context;

    @BeforeEach
    public void setUp() {
        driverFactory = new DriverFactory(NAMESPACE, Map.of(
                NAMESPACE + "Primary", () -> primaryDriver,
                NAMESPACE + "A", () -> firstFallbackDriver,
                NAMESPACE + "B", () -> secondFallbackDriver));
        ipAddressResolver = new IpAddressResolver(true, IP, "127.0.0.1", ClientIpSources.defaults());
        countryCodes = new CountryCodes("US,United States\nFR,France\n");

        session = new InMemorySessionStore();
        context = LocationContext.of(session, RequestEnvironment.empty());
    }

    @Test
    public void creationShouldFailWhenSelectedDriverIsNotRegistered() {
        assertThatThrownBy(() -> resolver("Unknown", emptyList(), false))
                .isInstanceOf(DriverNotFoundException.class)
                .hasMessageContaining("Unknown");
    }

    @Test
    public void getShouldReturnPrimaryDriverLocationAndStoreItInSession() {
        // given
        final Location location = success("Primary", "US");
        given(primaryDriver.get(IP)).willReturn(location);

        // when
        final Location result = resolver("Primary", asList("A", "B"), false).get(context);

        // then
        assertThat(result).isSameAs(location);
        assertThat(session.get(LocationResolver.SESSION_KEY)).isSameAs(location);
        verifyNoInteractions(firstFallbackDriver, secondFallbackDriver);
    }

    @Test
    public void getShouldReturnFirstSuccessfulFallbackLocation() {
        // given
        given(primaryDriver.get(IP)).willReturn(Location.failed("Primary", IP));
        given(firstFallbackDriver.get(IP)).willReturn(Location.failed("A", IP));
        final Location location = success("B", "FR");
        given(secondFallbackDriver.get(IP)).willReturn(location);

        // when
        final Location result = resolver("Primary", asList("A", "B"), false).get(context);

        // then
        assertThat(result).isSameAs(location);
        assertThat(session.get(LocationResolver.SESSION_KEY)).isSameAs(location);
    }

    @Test
    public void getShouldStopAtFirstSuccessfulFallback() {
        // given
        given(primaryDriver.get(IP)).willReturn(Location.failed("Primary", IP));
        given(firstFallbackDriver.get(IP)).willReturn(success("A", "US"));

        // when
        final Location result = resolver("Primary", asList("A", "B"), false).get(context);

        // then
        assertThat(result.getDriver()).isEqualTo("A");
        verifyNoInteractions(secondFallbackDriver);
    }

    @Test
    public void getShouldFailNamingLastTriedDriverWhenAllFallbacksFail() {
        // given
        given(primaryDriver.get(IP)).willReturn(Location.failed("Primary", IP));
        given(firstFallbackDriver.get(IP)).willReturn(Location.failed("A", IP));
        given(secondFallbackDriver.get(IP)).willReturn(Location.failed("B", IP));

        // when and then
        assertThatThrownBy(() -> resolver("Primary", asList("A", "B"), false).get(context))
                .isInstanceOfSatisfying(NoDriverAvailableException.class,
                        e -> assertThat(e.getLastDriver()).isEqualTo("B"));
        assertThat(session.has(LocationResolver.SESSION_KEY)).isFalse();
    }

    @Test
    public void getShouldFailNamingPrimaryDriverWhenNoFallbacksConfigured() {
        // given
        given(primaryDriver.get(IP)).willReturn(Location.failed("Primary", IP));

        // when and then
        assertThatThrownBy(() -> resolver("Primary", emptyList(), false).get(context))
                .isInstanceOfSatisfying(NoDriverAvailableException.class,
                        e -> assertThat(e.getLastDriver()).isEqualTo("Primary"));
    }

    @Test
    public void getShouldFailWhenFallbackDriverIsNotRegistered() {
        // given
        given(primaryDriver.get(IP)).willReturn(Location.failed("Primary", IP));

        // when and then
        assertThatThrownBy(() -> resolver("Primary", singletonList("Missing"), false).get(context))
                .isInstanceOf(DriverNotFoundException.class);
    }

    @Test
    public void getShouldFailWhenDriverReturnsNoLocation() {
        // given
        given(primaryDriver.get(IP)).willReturn(null);

        // when and then
        assertThatThrownBy(() -> resolver("Primary", emptyList(), false).get(context))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    public void getShouldReturnSessionLocationWithoutLookupWhateverIpIsRequested() {
        // given
        final Location cached = success("Primary", "US");
        session.set(LocationResolver.SESSION_KEY, cached);

        // when
        final Location result = resolver("Primary", emptyList(), false).get(context, "8.8.8.8");

        // then
        assertThat(result).isSameAs(cached);
        verifyNoInteractions(primaryDriver);
    }

    @Test
    public void getShouldNotValidateExplicitIpWhenLocationIsInSession() {
        // given
        final Location cached = success("Primary", "US");
        session.set(LocationResolver.SESSION_KEY, cached);

        // when
        final Location result = resolver("Primary", emptyList(), false).get(context, "not-an-ip");

        // then
        assertThat(result).isSameAs(cached);
    }

    @Test
    public void getShouldLookUpOnlyOnceWithinSession() {
        // given
        given(primaryDriver.get(IP)).willReturn(success("Primary", "US"));
        final LocationResolver resolver = resolver("Primary", emptyList(), false);

        // when
        resolver.get(context);
        resolver.get(context);

        // then
        verify(primaryDriver, times(1)).get(anyString());
    }

    @Test
    public void getShouldLookUpEveryTimeWhenLocationIsForgotten() {
        // given
        given(primaryDriver.get(IP)).willReturn(success("Primary", "US"));
        final LocationResolver resolver = resolver("Primary", emptyList(), true);

        // when
        resolver.get(context);
        resolver.get(context);

        // then
        verify(primaryDriver, times(2)).get(IP);
    }

    @Test
    public void getShouldLookUpExplicitIp() {
        // given
        given(primaryDriver.get("8.8.8.8")).willReturn(success("Primary", "US"));

        // when
        final Location result = resolver("Primary", emptyList(), false).get(context, "8.8.8.8");

        // then
        assertThat(result.getCountryCode()).isEqualTo("US");
    }

    @Test
    public void getShouldFailOnInvalidExplicitIpWithoutLookup() {
        // when and then
        assertThatThrownBy(() -> resolver("Primary", emptyList(), false).get(context, "999.1.1.1"))
                .isInstanceOf(InvalidAddressException.class);
        verifyNoInteractions(primaryDriver);
    }

    @Test
    public void getShouldReturnRequestedField() {
        // given
        given(primaryDriver.get(IP)).willReturn(success("Primary", "US"));

        // when
        final Object result = resolver("Primary", emptyList(), false).get(context, null, "countryCode");

        // then
        assertThat(result).isEqualTo("US");
    }

    @Test
    public void getShouldReturnNullForKnownFieldWithoutValue() {
        // given
        given(primaryDriver.get(IP)).willReturn(success("Primary", "US"));

        // when
        final Object result = resolver("Primary", emptyList(), false).get(context, null, "areaCode");

        // then
        assertThat(result).isNull();
    }

    @Test
    public void getShouldReturnWholeLocationWhenFieldIsNull() {
        // given
        final Location location = success("Primary", "US");
        given(primaryDriver.get(IP)).willReturn(location);

        // when
        final Object result = resolver("Primary", emptyList(), false).get(context, null, null);

        // then
        assertThat(result).isSameAs(location);
    }

    @Test
    public void getShouldFailOnUnknownFieldAndKeepLocationInSession() {
        // given
        final Location location = success("Primary", "US");
        given(primaryDriver.get(IP)).willReturn(location);

        // when and then
        assertThatThrownBy(() -> resolver("Primary", emptyList(), false).get(context, null, "planet"))
                .isInstanceOfSatisfying(FieldNotFoundException.class,
                        e -> assertThat(e.getField()).isEqualTo("planet"));
        assertThat(session.get(LocationResolver.SESSION_KEY)).isSameAs(location);
    }

    @Test
    public void isShouldMatchAnyAttributeIgnoringCase() {
        // given
        given(primaryDriver.get(IP)).willReturn(success("Primary", "US"));
        final LocationResolver resolver = resolver("Primary", emptyList(), false);

        // when and then
        assertThat(resolver.is(context, "US")).isTrue();
        assertThat(resolver.is(context, "us")).isTrue();
        assertThat(resolver.is(context, "Mountain View")).isTrue();
        assertThat(resolver.is(context, "FR")).isFalse();
    }

    @Test
    public void isShouldNotMatchErrorFlag() {
        // given
        given(primaryDriver.get(IP)).willReturn(success("Primary", "US"));

        // when and then
        assertThat(resolver("Primary", emptyList(), false).is(context, "false")).isFalse();
    }

    @Test
    public void listsShouldReturnCountriesByRequestedFields() {
        // when
        final Map<String, String> result = resolver("Primary", emptyList(), false)
                .lists(CountryCodes.COUNTRY_NAME_FIELD, CountryCodes.COUNTRY_CODE_FIELD);

        // then
        assertThat(result).containsExactly(entry("United States", "US"), entry("France", "FR"));
    }

    @Test
    public void listsShouldUseConfiguredDropdownFieldsWhenFieldsAreBlank() {
        // when
        final Map<String, String> result = resolver("Primary", emptyList(), false).lists(null, "");

        // then
        assertThat(result).containsExactly(entry("US", "United States"), entry("FR", "France"));
    }

    @Test
    @SuppressWarnings("deprecation")
    public void dropdownShouldReturnSameAsLists() {
        // given
        final LocationResolver resolver = resolver("Primary", emptyList(), false);

        // when and then
        assertThat(resolver.dropdown(null, null)).isEqualTo(resolver.lists(null, null));
    }

    @Test
    public void listsShouldFailOnUnknownField() {
        assertThatThrownBy(() -> resolver("Primary", emptyList(), false).lists("continent", "country_name"))
                .isInstanceOf(FieldNotFoundException.class);
    }

    @Test
    public void getShouldCreateFallbackDriverOnlyWhenPrimaryFails() {
        // given
        @SuppressWarnings("unchecked")
        final Supplier<LocationDriver> fallbackSupplier = mock(Supplier.class);
        driverFactory = new DriverFactory(NAMESPACE, Map.of(
                NAMESPACE + "Primary", () -> primaryDriver,
                NAMESPACE + "A", fallbackSupplier));
        given(primaryDriver.get(IP)).willReturn(success("Primary", "US"));

        // when
        resolver("Primary", singletonList("A"), false).get(context);

        // then
        verifyNoInteractions(fallbackSupplier);
    }

    private LocationResolver resolver(String selectedDriver, List<String> fallbackDrivers, boolean forget) {
        return new LocationResolver(
                selectedDriver,
                fallbackDrivers,
                forget,
                CountryCodes.COUNTRY_CODE_FIELD,
                CountryCodes.COUNTRY_NAME_FIELD,
                driverFactory,
                ipAddressResolver,
                countryCodes);
    }

    private static Location success(String driver, String countryCode) {
        return Location.builder()
                .driver(driver)
                .ip(IP)
                .countryCode(countryCode)
                .countryName("United States")
                .cityName("Mountain View")
                .error(false)
                .build();
    }
}
