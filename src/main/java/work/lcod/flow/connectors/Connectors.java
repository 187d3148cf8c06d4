package work.lcod.flow.connectors;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.flow.ast.ServiceDeclaration;
import work.lcod.flow.runtime.MockConnector;
import work.lcod.flow.runtime.ServiceConnector;

/**
 * Builds the connector table for a program's services.
 */
public final class Connectors {
    private Connectors() {}

    /**
     * @param mock when true every service gets a {@link MockConnector}; AI services always do
     */
    public static Map<String, ServiceConnector> forDeclarations(List<ServiceDeclaration> declarations, boolean mock) {
        Map<String, ServiceConnector> connectors = new LinkedHashMap<>();
        for (ServiceDeclaration declaration : declarations) {
            connectors.put(declaration.name(), mock ? new MockConnector(declaration.kind()) : real(declaration));
        }
        return connectors;
    }

    private static ServiceConnector real(ServiceDeclaration declaration) {
        switch (declaration.kind()) {
            case API:
                return new HttpApiConnector(declaration.target());
            case WEBHOOK:
                return new WebhookConnector(declaration.target());
            case PLUGIN:
                return new PluginStubConnector();
            default:
                return new MockConnector(declaration.kind());
        }
    }
}
