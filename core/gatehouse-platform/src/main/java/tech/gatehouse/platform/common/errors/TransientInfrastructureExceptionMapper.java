package tech.gatehouse.platform.common.errors;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;
import tech.gatehouse.platform.common.ErrorResponse;

/**
 * JAX-RS exception mapper for infrastructure faults that survived their retries.
 *
 * Returns 503 so clients retry later instead of treating the fault as a denial.
 */
@Provider
public class TransientInfrastructureExceptionMapper implements ExceptionMapper<TransientInfrastructureException> {

    private static final Logger LOG = Logger.getLogger(TransientInfrastructureExceptionMapper.class);

    @Override
    public Response toResponse(TransientInfrastructureException exception) {
        LOG.errorf(exception, "Infrastructure unavailable: %s", exception.getMessage());
        return Response.status(Response.Status.SERVICE_UNAVAILABLE)
            .type(MediaType.APPLICATION_JSON)
            .entity(new ErrorResponse("Service temporarily unavailable", "SERVICE_UNAVAILABLE"))
            .build();
    }
}
