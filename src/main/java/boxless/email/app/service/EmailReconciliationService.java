package boxless.email.app.service;

import boxless.email.app.entity.Email;
import boxless.email.app.entity.Label;
import boxless.email.app.entity.User;
import boxless.email.app.provider.ProviderLabel;
import boxless.email.app.provider.ProviderMessage;
import boxless.email.app.repository.EmailRepository;
import boxless.email.app.repository.LabelRepository;
import boxless.email.app.repository.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Create-if-absent mapping of provider records onto stored rows.
 * Every insert commits on its own, so a failure midway keeps what was already written.
 * Records are handled one after another; a concurrent run for the same user that inserts the
 * same key first is caught by the unique constraint and counted as already present. Any other
 * integrity violation is rethrown.
 */
@Slf4j
@Service
public class EmailReconciliationService {
    private final EmailRepository emailRepository;
    private final LabelRepository labelRepository;
    private final UserRepository userRepository;

    public EmailReconciliationService(
            EmailRepository emailRepository,
            LabelRepository labelRepository,
            UserRepository userRepository) {
        this.emailRepository = emailRepository;
        this.labelRepository = labelRepository;
        this.userRepository = userRepository;
    }

    public EmailReconcileResult reconcileEmails(Long userId, List<ProviderMessage> records) {
        User user = userRepository.getReferenceById(userId);
        int created = 0;
        int updated = 0;

        for (ProviderMessage record : records) {
            if (emailRepository.findByGmailMessageId(record.getId()).isPresent()) {
                updated++;
                continue;
            }
            try {
                emailRepository.save(toEmail(record, user));
                created++;
            } catch (DataIntegrityViolationException e) {
                // Only a row that is now present means another run won the insert.
                if (emailRepository.findByGmailMessageId(record.getId()).isEmpty()) {
                    throw e;
                }
                log.debug("Email {} was inserted concurrently for user {}", record.getId(), userId);
                updated++;
            }
        }

        log.debug("Reconciled {} emails for user {}: {} created, {} existing", records.size(), userId, created, updated);
        return new EmailReconcileResult(created, updated, records.size());
    }

    public LabelReconcileResult reconcileLabels(Long userId, List<ProviderLabel> records) {
        User user = userRepository.getReferenceById(userId);
        int created = 0;

        for (ProviderLabel record : records) {
            if (labelRepository.findByGmailLabelIdAndUserId(record.getId(), userId).isPresent()) {
                continue;
            }
            try {
                labelRepository.save(toLabel(record, user));
                created++;
            } catch (DataIntegrityViolationException e) {
                if (labelRepository.findByGmailLabelIdAndUserId(record.getId(), userId).isEmpty()) {
                    throw e;
                }
                log.debug("Label {} was inserted concurrently for user {}", record.getId(), userId);
            }
        }

        log.debug("Reconciled {} labels for user {}: {} created", records.size(), userId, created);
        return new LabelReconcileResult(created, records.size());
    }

    private Email toEmail(ProviderMessage record, User user) {
        Email email = new Email();
        email.setGmailMessageId(record.getId());
        email.setThreadId(record.getThreadId());
        email.setSubject(record.getSubject());
        email.setSender(record.getSender());
        email.setRecipient(record.getRecipient());
        email.setCc(record.getCc());
        email.setBcc(record.getBcc());
        email.setDateSent(record.getDateSent());
        email.setDateReceived(record.getDateReceived());
        email.setBodyText(record.getBodyText());
        email.setBodyHtml(record.getBodyHtml());
        email.setSnippet(record.getSnippet());
        email.setRead(record.isRead());
        email.setStarred(record.isStarred());
        email.setImportant(record.isImportant());
        email.setRawHeaders(record.getHeaders());
        email.setAttachmentsCount(record.getAttachmentCount());
        email.setUser(user);
        return email;
    }

    private Label toLabel(ProviderLabel record, User user) {
        Label label = new Label();
        label.setGmailLabelId(record.getId());
        label.setName(record.getName());
        label.setLabelType(record.getType());
        label.setMessagesTotal(record.getMessagesTotal());
        label.setMessagesUnread(record.getMessagesUnread());
        label.setUser(user);
        return label;
    }
}
