package boxless.email.app.controller;

import boxless.email.app.repository.UserRepository;
import boxless.email.app.service.EmailSyncService;
import boxless.email.app.service.SyncDispatcher;
import boxless.email.app.service.SyncResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Callback endpoints for sync tasks, called by Cloud Tasks or by hand.
 * A run that ends in status "failed" is still a 200: the failure is in the body.
 */
@Slf4j
@RestController
@RequestMapping("/tasks")
public class SyncTaskController {
    private final EmailSyncService emailSyncService;
    private final SyncDispatcher syncDispatcher;
    private final UserRepository userRepository;

    public SyncTaskController(
            EmailSyncService emailSyncService,
            SyncDispatcher syncDispatcher,
            UserRepository userRepository) {
        this.emailSyncService = emailSyncService;
        this.syncDispatcher = syncDispatcher;
        this.userRepository = userRepository;
    }

    @PostMapping("/sync-user")
    public ResponseEntity<?> syncUser(@RequestBody(required = false) SyncUserRequest request) {
        if (request == null || request.getUserId() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "user_id is required"));
        }
        Long userId = request.getUserId();
        if (!userRepository.existsById(userId)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "User " + userId + " not found"));
        }

        SyncResult result = emailSyncService.runUserSync(userId);
        return ResponseEntity.ok(result);
    }

    @PostMapping("/sync-all-users")
    public ResponseEntity<Map<String, Object>> syncAllUsers() {
        int scheduled = syncDispatcher.scheduleAllActive();
        return ResponseEntity.ok(Map.of("status", "scheduled", "users", scheduled));
    }
}
