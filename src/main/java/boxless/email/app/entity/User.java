package boxless.email.app.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "users")
@Getter
@Setter
@ToString(exclude = {"emails", "labels", "token"})
@EqualsAndHashCode(exclude = {"emails", "labels"})
public class User {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private String email;

    @Column(unique = true)
    private String gmailUserId;

    @Embedded
    private OAuthToken token;

    private boolean active = true;

    @CreationTimestamp
    private Instant createdAt;

    @UpdateTimestamp
    private Instant updatedAt;

    @OneToMany(mappedBy = "user")
    private List<Email> emails = new ArrayList<>();

    @OneToMany(mappedBy = "user")
    private List<Label> labels = new ArrayList<>();

    public boolean hasAccessToken() {
        return token != null && token.getAccessToken() != null && !token.getAccessToken().isEmpty();
    }
}
