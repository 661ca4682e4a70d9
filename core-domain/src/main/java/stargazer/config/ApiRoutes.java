package stargazer.config;

public final class ApiRoutes {

    private ApiRoutes() {}

    // Versión base
    public static final String CURRENT_VERSION = "/v1";

    // Rutas específicas
    public static final String SKY = CURRENT_VERSION + "/sky";
    public static final String ADMIN = CURRENT_VERSION + "/admin";
}
