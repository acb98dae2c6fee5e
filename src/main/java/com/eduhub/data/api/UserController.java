package com.eduhub.data.api;

import com.eduhub.data.domain.DomainModels;
import com.eduhub.data.error.NotFoundException;
import com.eduhub.data.service.UserService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/users")
public class UserController {
    private final UserService userService;

    public UserController(UserService userService) {
        this.userService = userService;
    }

    @PostMapping
    public ResponseEntity<CreatedResponse> create(@RequestBody DomainModels.NewUser request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(new CreatedResponse(userService.createUser(request)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<DomainModels.User> byId(@PathVariable String id) {
        return ResponseEntity.ok(userService.findUserById(id)
                .orElseThrow(() -> new NotFoundException("User not found: " + id)));
    }

    @GetMapping(params = "email")
    public ResponseEntity<DomainModels.User> byEmail(@RequestParam String email) {
        return ResponseEntity.ok(userService.findUserByEmail(email)
                .orElseThrow(() -> new NotFoundException("User not found: " + email)));
    }

    @GetMapping("/active-students")
    public ResponseEntity<List<DomainModels.User>> activeStudents() {
        return ResponseEntity.ok(userService.findActiveStudents());
    }

    @PatchMapping("/{id}")
    public ResponseEntity<ModifiedResponse> updateProfile(@PathVariable String id, @RequestBody Map<String, Object> updates) {
        return ResponseEntity.ok(new ModifiedResponse(userService.updateUserProfile(id, updates)));
    }

    public record CreatedResponse(String id) {}

    public record ModifiedResponse(long modified) {}
}
