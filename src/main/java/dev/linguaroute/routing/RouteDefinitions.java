package dev.linguaroute.routing;

import java.util.List;

/**
 * Root of the route definition file.
 */
public record RouteDefinitions(List<LogicalRoute> routes) {

    public RouteDefinitions {
        routes = routes == null ? List.of() : List.copyOf(routes);
    }
}
