package com.bteshome.todo.todoservice.controller;

import com.bteshome.todo.todoservice.service.TodoService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping(value = "/v1/todo", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
@Slf4j
public class TodoController {
    private final TodoService todoService;

    @GetMapping
    public ResponseEntity<?> getAll() {
        return todoService.getAll();
    }

    @PutMapping
    public ResponseEntity<?> create(@RequestBody(required = false) String body) {
        return todoService.create(body);
    }

    @GetMapping("/{todoId}")
    public ResponseEntity<?> get(@PathVariable("todoId") String todoId) {
        return todoService.get(todoId);
    }

    @PutMapping("/{todoId}")
    public ResponseEntity<?> update(@PathVariable("todoId") String todoId,
                                    @RequestBody(required = false) String body) {
        return todoService.update(todoId, body);
    }

    @DeleteMapping("/{todoId}")
    public ResponseEntity<?> delete(@PathVariable("todoId") String todoId) {
        return todoService.delete(todoId);
    }
}
