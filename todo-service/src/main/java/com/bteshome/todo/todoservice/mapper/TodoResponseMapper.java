package com.bteshome.todo.todoservice.mapper;

import com.bteshome.todo.storeclient.responses.*;
import com.bteshome.todo.todoservice.TodoValidationException;
import com.bteshome.todo.todoservice.UnclassifiedOutcomeException;
import com.bteshome.todo.todoservice.common.AppSettings;
import com.bteshome.todo.todoservice.dto.ErrorResponse;
import com.bteshome.todo.todoservice.dto.MessageResponse;
import com.bteshome.todo.todoservice.dto.TodoResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Turns a store response into the HTTP status and body returned to the caller.
 * <p>
 * Store responses are classified by status family: 2xx is a success, 4xx a failure (a failed
 * condition is told apart only for logging), anything else is unclassified and raises
 * {@link UnclassifiedOutcomeException}. Every failure is answered with 400 and the message of the
 * operation. A get that finds no item is answered with 400 as well, not 404.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TodoResponseMapper {
    public static final String CREATED = "To-Do object created successfully.";
    public static final String UPDATED = "To-Do object updated successfully.";
    public static final String DELETED = "To-Do object deleted successfully.";
    public static final String LOAD_ERROR = "There was an error loading the To-Do objects.";
    public static final String CREATE_ERROR = "There was an error while creating a new To-Do object.";
    public static final String UPDATE_ERROR = "There was an error while updating the To-Do object.";
    public static final String DELETE_ERROR = "There has been an error while deleting the To-Do object.";
    public static final String INVALID_BODY = "Invalid request body";
    public static final String INTERNAL_ERROR = "Internal server error";

    private final AppSettings appSettings;

    public OutcomeType classify(StoreResponse response) {
        if (response == null)
            return OutcomeType.UNCLASSIFIED;

        HttpStatus.Series series = HttpStatus.Series.resolve(response.getHttpStatusCode());

        if (series == HttpStatus.Series.SUCCESSFUL)
            return OutcomeType.SUCCESS;
        if (series == HttpStatus.Series.CLIENT_ERROR)
            return response.isConditionalCheckFailed() ? OutcomeType.CONDITIONAL_CHECK_FAILED : OutcomeType.FAILURE;
        return OutcomeType.UNCLASSIFIED;
    }

    public ResponseEntity<?> toListResponse(ItemScanResponse response) {
        if (!succeeded(TodoOperation.LIST, response))
            return ResponseEntity.badRequest().body(new ErrorResponse(LOAD_ERROR));

        List<TodoResponse> todos = response.getItems() == null
                ? List.of()
                : response.getItems().stream().map(this::toTodoResponse).toList();

        return ResponseEntity.ok(todos);
    }

    public ResponseEntity<?> toCreateResponse(ItemPutResponse response) {
        if (!succeeded(TodoOperation.CREATE, response))
            return ResponseEntity.badRequest().body(new MessageResponse(CREATE_ERROR));
        return ResponseEntity.ok(new MessageResponse(CREATED));
    }

    public ResponseEntity<?> toGetResponse(ItemGetResponse response) {
        if (!succeeded(TodoOperation.GET, response))
            return ResponseEntity.badRequest().body(new ErrorResponse(LOAD_ERROR));

        if (response.getItem() == null || response.getItem().isEmpty()) {
            log.debug("GET found no item, answering with status 400.");
            return ResponseEntity.badRequest().body(new ErrorResponse(LOAD_ERROR));
        }

        return ResponseEntity.ok(toTodoResponse(response.getItem()));
    }

    public ResponseEntity<?> toUpdateResponse(ItemPutResponse response) {
        if (!succeeded(TodoOperation.UPDATE, response))
            return ResponseEntity.badRequest().body(new ErrorResponse(UPDATE_ERROR));
        return ResponseEntity.ok(new MessageResponse(UPDATED));
    }

    public ResponseEntity<?> toDeleteResponse(ItemDeleteResponse response) {
        if (!succeeded(TodoOperation.DELETE, response))
            return ResponseEntity.badRequest().body(new ErrorResponse(DELETE_ERROR));
        return ResponseEntity.ok(new MessageResponse(DELETED));
    }

    public ResponseEntity<?> toRejectedResponse(TodoOperation operation, TodoValidationException e) {
        log.debug("{} rejected: {}", operation, e.getMessage());
        return ResponseEntity.badRequest().body(new MessageResponse(INVALID_BODY));
    }

    public ResponseEntity<?> toUnhandledResponse(TodoOperation operation, Exception e) {
        log.error("{} failed with an unhandled error.", operation, e);
        return ResponseEntity.internalServerError().body(new MessageResponse(INTERNAL_ERROR));
    }

    private boolean succeeded(TodoOperation operation, StoreResponse response) {
        OutcomeType outcome = classify(response);

        switch (outcome) {
            case SUCCESS:
                return true;
            case CONDITIONAL_CHECK_FAILED:
                log.debug("{} failed its store condition: {}", operation, response.getErrorMessage());
                return false;
            case FAILURE:
                log.warn("{} failed. Status code={}, error code={}, error message={}",
                        operation,
                        response.getHttpStatusCode(),
                        response.getErrorCode(),
                        response.getErrorMessage());
                return false;
            default:
                throw new UnclassifiedOutcomeException("Unclassified store outcome for %s. Status code=%s, error code=%s, error message=%s".formatted(
                        operation,
                        response == null ? null : response.getHttpStatusCode(),
                        response == null ? null : response.getErrorCode(),
                        response == null ? null : response.getErrorMessage()));
        }
    }

    private TodoResponse toTodoResponse(Map<String, String> item) {
        return TodoResponse.builder()
                .id(item.get(appSettings.getPartitionKey()))
                .title(item.get(TodoRequestMapper.TITLE))
                .description(item.get(TodoRequestMapper.DESCRIPTION))
                .build();
    }
}
