package com.studyspots.controller;

import com.studyspots.dto.LoginRequest;
import com.studyspots.dto.LoginResponse;
import com.studyspots.model.User;
import com.studyspots.service.UserService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import jakarta.validation.Valid;

@RestController
@RequiredArgsConstructor
@Tag(name = "Auth", description = "Plain-text login")
public class AuthController {

    private final UserService userService;

    @PostMapping("/login")
    @Operation(summary = "Check a user's name and password")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
        User user = userService.authenticate(request.getName(), request.getPassword());
        return ResponseEntity.ok(new LoginResponse("Login successful", user.getId(), user.getName()));
    }
}
