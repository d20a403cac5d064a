package boxless.email.app.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;

@Entity
@Table(name = "attachments")
@Getter
@Setter
@ToString(exclude = "email")
@EqualsAndHashCode(exclude = "email")
public class Attachment {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String filename;

    private String contentType;

    private Long size;

    private String attachmentId; // Gmail attachment ID

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "email_id")
    private Email email;

    private String filePath;

    @CreationTimestamp
    private Instant createdAt;
}
