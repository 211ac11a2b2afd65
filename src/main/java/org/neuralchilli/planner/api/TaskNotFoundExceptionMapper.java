package org.neuralchilli.planner.api;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.neuralchilli.planner.service.TaskNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@Provider
public class TaskNotFoundExceptionMapper implements ExceptionMapper<TaskNotFoundException> {

    private static final Logger log = LoggerFactory.getLogger(TaskNotFoundExceptionMapper.class);

    @Override
    public Response toResponse(TaskNotFoundException exception) {
        log.debug("Task lookup failed: {}", exception.getMessage());
        return Response.status(Response.Status.NOT_FOUND)
                .type(MediaType.APPLICATION_JSON)
                .entity(new ErrorView(404, "Not Found", exception.getMessage()))
                .build();
    }
}
