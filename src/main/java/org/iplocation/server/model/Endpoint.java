package org.iplocation.server.model;

/**
 * Describes statically routed endpoints.
 */
public enum Endpoint {

    location("/location"),
    location_is("/location/is"),
    countries("/countries");

    private final String value;

    Endpoint(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
