package boxless.email.app.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.Map;

/**
 * A message as first captured from the provider. Rows are written once and not refreshed by
 * later syncs.
 */
@Entity
@Table(name = "emails", indexes = {
        @Index(name = "ix_emails_thread_id", columnList = "thread_id"),
        @Index(name = "ix_emails_user_id", columnList = "user_id")
})
@Getter
@Setter
@ToString(exclude = {"user", "bodyText", "bodyHtml", "rawHeaders"})
@EqualsAndHashCode(exclude = "user")
public class Email {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private String gmailMessageId;

    @Column(name = "thread_id")
    private String threadId;

    @Column(columnDefinition = "TEXT")
    private String subject;

    @Column(columnDefinition = "TEXT")
    private String sender;

    @Column(columnDefinition = "TEXT")
    private String recipient;

    @Column(columnDefinition = "TEXT")
    private String cc;

    @Column(columnDefinition = "TEXT")
    private String bcc;

    private Instant dateSent;

    private Instant dateReceived;

    @Column(columnDefinition = "TEXT")
    private String bodyText;

    @Column(columnDefinition = "TEXT")
    private String bodyHtml;

    @Column(columnDefinition = "TEXT")
    private String snippet;

    @Column(name = "is_read")
    private boolean read;

    @Column(name = "is_important")
    private boolean important;

    @Column(name = "is_starred")
    private boolean starred;

    @Convert(converter = HeadersJsonConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, String> rawHeaders;

    private int attachmentsCount;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id")
    private User user;

    @CreationTimestamp
    private Instant createdAt;

    @UpdateTimestamp
    private Instant updatedAt;
}
