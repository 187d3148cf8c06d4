package work.lcod.flow.runtime;

import java.util.concurrent.CompletionStage;

/**
 * Performs the external work behind a declared service. A failure is either an exceptionally
 * completed stage or an exception thrown by {@link #call}.
 */
@FunctionalInterface
public interface ServiceConnector {
    CompletionStage<ServiceResponse> call(ServiceRequest request);
}
