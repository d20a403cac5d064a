package boxless.email.app.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;

/**
 * Email to label association. The batch sync does not fill this table yet.
 */
@Entity
@Table(name = "email_labels")
@Getter
@Setter
@ToString(exclude = {"email", "label"})
@EqualsAndHashCode(exclude = {"email", "label"})
public class EmailLabel {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "email_id")
    private Email email;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "label_id")
    private Label label;

    @CreationTimestamp
    private Instant createdAt;
}
