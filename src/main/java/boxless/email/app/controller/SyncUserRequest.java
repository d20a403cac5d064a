package boxless.email.app.controller;

import lombok.Data;

@Data
public class SyncUserRequest {
    private Long userId;
}
