package org.iplocation.server.location;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.iplocation.server.exception.FieldNotFoundException;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Table of ISO-3166-1-alpha-2 country codes and country names, used to build country lists.
 */
public class CountryCodes {

    public static final String COUNTRY_CODE_FIELD = "country_code";
    public static final String COUNTRY_NAME_FIELD = "country_name";

    private final List<Pair<String, String>> countries;

    public CountryCodes(String countryCodesCsv) {
        countries = Arrays.stream(countryCodesCsv.split("\n"))
                .filter(StringUtils::isNotBlank)
                .map(CountryCodes::parseCountryCodesCsvRow)
                .toList();
    }

    public List<Pair<String, String>> countries() {
        return countries;
    }

    public String nameOf(String countryCode) {
        final String code = StringUtils.upperCase(countryCode);
        return countries.stream()
                .filter(country -> country.getKey().equals(code))
                .map(Pair::getValue)
                .findFirst()
                .orElse(null);
    }

    /**
     * Returns an ordered map of every country, keyed by the {@code valueField} and holding the {@code nameField}.
     *
     * @throws FieldNotFoundException if one of the fields is neither country code nor country name
     */
    public Map<String, String> lists(String valueField, String nameField) {
        final Function<Pair<String, String>, String> valueExtractor = extractor(valueField);
        final Function<Pair<String, String>, String> nameExtractor = extractor(nameField);

        final Map<String, String> list = new LinkedHashMap<>();
        countries.forEach(country -> list.put(valueExtractor.apply(country), nameExtractor.apply(country)));
        return Collections.unmodifiableMap(list);
    }

    private static Function<Pair<String, String>, String> extractor(String field) {
        if (COUNTRY_CODE_FIELD.equals(field)) {
            return Pair::getKey;
        }
        if (COUNTRY_NAME_FIELD.equals(field)) {
            return Pair::getValue;
        }
        throw new FieldNotFoundException(field);
    }

    private static Pair<String, String> parseCountryCodesCsvRow(String row) {
        final String code = StringUtils.trim(StringUtils.substringBefore(row, ","));
        final String name = StringUtils.unwrap(StringUtils.trim(StringUtils.substringAfter(row, ",")), '"');
        if (code.length() != 2 || !StringUtils.isAlpha(code) || StringUtils.isEmpty(name)) {
            throw new IllegalArgumentException(
                    "Invalid csv file format: row \"%s\" should contain alpha-2 code and country name"
                            .formatted(row));
        }

        return Pair.of(code.toUpperCase(), name);
    }
}
