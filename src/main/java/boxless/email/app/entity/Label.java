package boxless.email.app.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

@Entity
@Table(name = "labels", uniqueConstraints = {
        @UniqueConstraint(name = "uq_labels_gmail_label_user", columnNames = {"gmail_label_id", "user_id"})
})
@Getter
@Setter
@ToString(exclude = "user")
@EqualsAndHashCode(exclude = "user")
public class Label {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "gmail_label_id", nullable = false)
    private String gmailLabelId;

    @Column(nullable = false)
    private String name;

    private String labelType; // system, user

    private int messagesTotal;

    private int messagesUnread;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id")
    private User user;

    @CreationTimestamp
    private Instant createdAt;

    @UpdateTimestamp
    private Instant updatedAt;
}
