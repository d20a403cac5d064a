package boxless.email.app.controller;

import boxless.email.app.repository.UserRepository;
import boxless.email.app.service.SyncStatusService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class SyncStatusController {
    private final SyncStatusService syncStatusService;
    private final UserRepository userRepository;

    public SyncStatusController(SyncStatusService syncStatusService, UserRepository userRepository) {
        this.syncStatusService = syncStatusService;
        this.userRepository = userRepository;
    }

    @GetMapping("/sync/status/{userId}")
    public ResponseEntity<?> getStatus(@PathVariable Long userId) {
        if (!userRepository.existsById(userId)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "User " + userId + " not found"));
        }
        return ResponseEntity.ok(syncStatusService.read(userId));
    }
}
