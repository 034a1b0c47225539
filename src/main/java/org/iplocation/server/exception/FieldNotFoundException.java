package org.iplocation.server.exception;

import lombok.Getter;

@Getter
public class FieldNotFoundException extends LocationException {

    private final String field;

    public FieldNotFoundException(String field) {
        super(("Location field: %s does not exist. Please check the docs"
                + " to verify which fields are available.").formatted(field));
        this.field = field;
    }
}
