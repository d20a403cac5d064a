package boxless.email.app.repository;

import boxless.email.app.entity.Label;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface LabelRepository extends JpaRepository<Label, Long> {
    Optional<Label> findByGmailLabelIdAndUserId(String gmailLabelId, Long userId);
    long countByUserId(Long userId);
}
