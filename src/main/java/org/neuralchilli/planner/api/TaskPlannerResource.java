package org.neuralchilli.planner.api;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.neuralchilli.planner.api.TaskRequests.DependenciesRequest;
import org.neuralchilli.planner.api.TaskRequests.MoveRequest;
import org.neuralchilli.planner.api.TaskRequests.PriorityRequest;
import org.neuralchilli.planner.api.TaskRequests.ScheduleRequest;
import org.neuralchilli.planner.api.TaskRequests.StarRequest;
import org.neuralchilli.planner.api.TaskRequests.StatusRequest;
import org.neuralchilli.planner.api.TaskRequests.SubtaskRequest;
import org.neuralchilli.planner.domain.DependencyMode;
import org.neuralchilli.planner.domain.MovePosition;
import org.neuralchilli.planner.domain.TaskId;
import org.neuralchilli.planner.domain.TaskSchema;
import org.neuralchilli.planner.domain.TaskStatus;
import org.neuralchilli.planner.monitoring.EvaluationMonitor;
import org.neuralchilli.planner.service.NextActionService;
import org.neuralchilli.planner.service.TaskMutationService;

import java.util.List;
import java.util.Locale;

@Path("/tasks")
@Produces(MediaType.APPLICATION_JSON)
public class TaskPlannerResource {

    @Inject
    NextActionService nextActionService;

    @Inject
    TaskMutationService mutationService;

    @Inject
    EvaluationMonitor monitor;

    @Inject
    TaskSchema schema;

    @GET
    @Path("/evaluations")
    public List<EvaluationView> evaluations() {
        return EvaluationView.from(nextActionService.collectNextActionEvaluations(schema));
    }

    @GET
    @Path("/next-actions")
    public List<EvaluationView> nextActions() {
        return EvaluationView.from(nextActionService.collectNextActionItems(schema));
    }

    @GET
    @Path("/ranked")
    public List<EvaluationView> ranked() {
        return EvaluationView.from(nextActionService.collectRankedTasks(schema));
    }

    @GET
    @Path("/statistics")
    public StatisticsView statistics() {
        return StatisticsView.from(nextActionService.statistics(schema));
    }

    @GET
    @Path("/metrics")
    public EvaluationMonitor.MonitorReport metrics() {
        return monitor.getReport();
    }

    @GET
    @Path("/{id}/evaluation")
    public EvaluationView evaluation(@PathParam("id") long id) {
        return EvaluationView.from(nextActionService.findEvaluation(schema, id));
    }

    @POST
    @Path("/{id}/status/cycle")
    public EvaluationView cycleStatus(@PathParam("id") long id) {
        mutationService.cycleStatus(id);
        return evaluation(id);
    }

    @PUT
    @Path("/{id}/status")
    @Consumes(MediaType.APPLICATION_JSON)
    public EvaluationView setStatus(@PathParam("id") long id, StatusRequest request) {
        mutationService.setStatus(id, parseStatus(request == null ? null : request.status()));
        return evaluation(id);
    }

    @POST
    @Path("/{id}/complete")
    public EvaluationView complete(@PathParam("id") long id) {
        mutationService.complete(id);
        return evaluation(id);
    }

    @PUT
    @Path("/{id}/star")
    @Consumes(MediaType.APPLICATION_JSON)
    public EvaluationView setStar(@PathParam("id") long id, StarRequest request) {
        mutationService.setStar(id, request != null && request.star());
        return evaluation(id);
    }

    @PUT
    @Path("/{id}/dependencies")
    @Consumes(MediaType.APPLICATION_JSON)
    public EvaluationView setDependencies(@PathParam("id") long id, DependenciesRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Request body is required");
        }
        mutationService.setDependencies(
                id,
                request.dependsOn(),
                DependencyMode.fromString(request.mode()),
                request.delayHours()
        );
        return evaluation(id);
    }

    @PUT
    @Path("/{id}/schedule")
    @Consumes(MediaType.APPLICATION_JSON)
    public EvaluationView setSchedule(@PathParam("id") long id, ScheduleRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Request body is required");
        }
        mutationService.setSchedule(id, request.startTime(), request.endTime());
        return evaluation(id);
    }

    @PUT
    @Path("/{id}/priority")
    @Consumes(MediaType.APPLICATION_JSON)
    public EvaluationView setPriority(@PathParam("id") long id, PriorityRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Request body is required");
        }
        mutationService.setPriority(id, request.importance(), request.urgency(), request.effort());
        return evaluation(id);
    }

    /**
     * Create a todo task below any block; responds 201 with the new task's evaluation
     */
    @POST
    @Path("/{id}/subtasks")
    @Consumes(MediaType.APPLICATION_JSON)
    public Response addSubtask(@PathParam("id") long id, SubtaskRequest request) {
        TaskId created = mutationService.addSubtask(id, request == null ? null : request.text());
        return Response.status(Response.Status.CREATED)
                .entity(evaluation(created.value()))
                .build();
    }

    @POST
    @Path("/{id}/move")
    @Consumes(MediaType.APPLICATION_JSON)
    public EvaluationView moveTask(@PathParam("id") long id, MoveRequest request) {
        if (request == null || request.target() == null) {
            throw new IllegalArgumentException("Move target is required");
        }
        mutationService.moveTask(id, request.target(), MovePosition.fromString(request.position()));
        return evaluation(id);
    }

    @DELETE
    @Path("/{id}")
    public Response removeTask(@PathParam("id") long id) {
        mutationService.removeTask(id);
        return Response.noContent().build();
    }

    @POST
    @Path("/cache/invalidate")
    public Response invalidateCache() {
        nextActionService.invalidateNextActionEvaluationCache();
        return Response.noContent().build();
    }

    /**
     * Accept a status name (DOING) or any label the schema knows (Doing, Cancelled).
     */
    private TaskStatus parseStatus(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Status is required");
        }
        String normalized = value.trim();
        for (TaskStatus status : TaskStatus.values()) {
            if (status.name().equalsIgnoreCase(normalized)
                    || schema.labelOf(status).equalsIgnoreCase(normalized)) {
                return status;
            }
        }
        boolean canceled = schema.canceledChoices().stream()
                .anyMatch(choice -> choice.toLowerCase(Locale.ROOT).equals(normalized.toLowerCase(Locale.ROOT)));
        if (canceled) {
            return TaskStatus.CANCELED;
        }
        throw new IllegalArgumentException("Unknown status: " + value);
    }
}
