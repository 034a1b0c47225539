package org.iplocation.server.location.model;

import lombok.Value;
import org.iplocation.server.session.SessionStore;

@Value(staticConstructor = "of")
public class LocationContext {

    SessionStore session;

    RequestEnvironment environment;
}
