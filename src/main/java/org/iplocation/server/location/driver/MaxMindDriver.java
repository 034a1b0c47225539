package org.iplocation.server.location.driver;

import com.maxmind.db.Reader;
import com.maxmind.geoip2.DatabaseReader;
import com.maxmind.geoip2.exception.GeoIp2Exception;
import com.maxmind.geoip2.model.CityResponse;
import com.maxmind.geoip2.record.City;
import com.maxmind.geoip2.record.Country;
import com.maxmind.geoip2.record.Postal;
import com.maxmind.geoip2.record.Subdivision;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.lang3.StringUtils;
import org.iplocation.server.exception.LocationException;
import org.iplocation.server.location.LocationDriver;
import org.iplocation.server.location.model.Location;
import org.iplocation.server.log.Logger;
import org.iplocation.server.log.LoggerFactory;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.net.InetAddress;
import java.util.List;
import java.util.zip.GZIPInputStream;

/**
 * Implementation of the {@link LocationDriver}
 * backed by <a href="https://dev.maxmind.com/geoip/geoip2/geolite2/">MaxMind free database</a>
 */
public class MaxMindDriver implements LocationDriver {

    private static final Logger logger = LoggerFactory.getLogger(MaxMindDriver.class);

    public static final String NAME = "MaxMind";

    private static final String DATABASE_FILE_NAME = "GeoLite2-City.mmdb";

    private final DatabaseReader databaseReader;

    public MaxMindDriver(DatabaseReader databaseReader) {
        this.databaseReader = databaseReader; // null when database is not set up
    }

    /**
     * Creates the driver over a database file, either plain {@code .mmdb} or a {@code .tar.gz} archive
     * containing it. A database which cannot be read leaves the driver failing every lookup.
     */
    public static MaxMindDriver create(String databasePath) {
        try {
            return new MaxMindDriver(readDatabase(databasePath));
        } catch (LocationException e) {
            logger.warn("MaxMind driver is unavailable: {}", e.getMessage());
            return new MaxMindDriver(null);
        }
    }

    private static DatabaseReader readDatabase(String databasePath) {
        if (StringUtils.isBlank(databasePath)) {
            throw new LocationException("Database path is not configured");
        }

        try {
            return StringUtils.endsWithAny(databasePath, ".tar.gz", ".tgz")
                    ? readArchive(databasePath)
                    : new DatabaseReader.Builder(new File(databasePath)).fileMode(Reader.FileMode.MEMORY).build();
        } catch (IOException e) {
            throw new LocationException(
                    "IO Exception occurred while trying to read an archive/db file: %s".formatted(e.getMessage()), e);
        }
    }

    private static DatabaseReader readArchive(String archivePath) throws IOException {
        try (TarArchiveInputStream tarInput = new TarArchiveInputStream(new GZIPInputStream(
                new FileInputStream(archivePath)))) {

            TarArchiveEntry currentEntry;
            while ((currentEntry = tarInput.getNextTarEntry()) != null) {
                if (currentEntry.getName().contains(DATABASE_FILE_NAME)) {
                    return new DatabaseReader.Builder(tarInput).fileMode(Reader.FileMode.MEMORY).build();
                }
            }
        }

        throw new LocationException("Database file %s not found in %s archive".formatted(DATABASE_FILE_NAME,
                archivePath));
    }

    @Override
    public Location get(String ip) {
        if (databaseReader == null) {
            logger.debug("MaxMind database is not set up, lookup for {} skipped", ip);
            return Location.failed(NAME, ip);
        }

        try {
            final CityResponse cityResponse = databaseReader.city(InetAddress.getByName(ip));
            return toLocation(ip, cityResponse);
        } catch (IOException | GeoIp2Exception e) {
            logger.debug("MaxMind lookup for {} failed: {}", ip, e.getMessage());
            return Location.failed(NAME, ip);
        }
    }

    private static Location toLocation(String ip, CityResponse cityResponse) {
        final com.maxmind.geoip2.record.Location location = cityResponse != null ? cityResponse.getLocation() : null;
        final Subdivision subdivision = resolveSubdivision(cityResponse);
        final Country country = cityResponse != null ? cityResponse.getCountry() : null;
        final City city = cityResponse != null ? cityResponse.getCity() : null;
        final Postal postal = cityResponse != null ? cityResponse.getPostal() : null;
        final String countryCode = country != null ? country.getIsoCode() : null;

        return Location.builder()
                .driver(NAME)
                .ip(ip)
                .countryCode(countryCode)
                .isoCode(countryCode)
                .countryName(country != null ? country.getName() : null)
                .regionCode(subdivision != null ? subdivision.getIsoCode() : null)
                .regionName(subdivision != null ? subdivision.getName() : null)
                .cityName(city != null ? city.getName() : null)
                .postalCode(postal != null ? postal.getCode() : null)
                .metroCode(resolveMetroCode(location))
                .latitude(location != null ? location.getLatitude() : null)
                .longitude(location != null ? location.getLongitude() : null)
                .timeZone(location != null ? location.getTimeZone() : null)
                .error(false)
                .build();
    }

    private static Subdivision resolveSubdivision(CityResponse cityResponse) {
        final List<Subdivision> subdivisions = cityResponse != null ? cityResponse.getSubdivisions() : null;
        return CollectionUtils.isEmpty(subdivisions) ? null : subdivisions.get(0);
    }

    private static String resolveMetroCode(com.maxmind.geoip2.record.Location location) {
        final Integer metroCode = location != null ? location.getMetroCode() : null;
        return metroCode != null ? metroCode.toString() : null;
    }
}
