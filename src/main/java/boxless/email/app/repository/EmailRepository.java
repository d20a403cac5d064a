package boxless.email.app.repository;

import boxless.email.app.entity.Email;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface EmailRepository extends JpaRepository<Email, Long> {
    Optional<Email> findByGmailMessageId(String gmailMessageId);
    long countByUserId(Long userId);
}
