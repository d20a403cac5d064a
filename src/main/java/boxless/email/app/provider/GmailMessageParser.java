package boxless.email.app.provider;

import com.google.api.services.gmail.model.Message;
import com.google.api.services.gmail.model.MessagePart;
import com.google.api.services.gmail.model.MessagePartHeader;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Normalizes a Gmail API message (fetched with format=full) into a {@link ProviderMessage}.
 */
@Slf4j
public class GmailMessageParser {
    static final String NO_SUBJECT = "No Subject";
    static final String UNKNOWN_SENDER = "Unknown Sender";

    public ProviderMessage parse(Message message) {
        MessagePart payload = message.getPayload();
        Map<String, String> headers = collectHeaders(payload);
        List<String> labelIds = message.getLabelIds() != null ? message.getLabelIds() : Collections.emptyList();

        BodyExtractionResult body = new BodyExtractionResult();
        int attachmentCount = 0;
        if (payload != null) {
            extractBodyFromParts(payload, body);
            attachmentCount = countAttachments(payload);
        }

        return ProviderMessage.builder()
                .id(message.getId())
                .threadId(message.getThreadId())
                .subject(headers.getOrDefault("Subject", NO_SUBJECT))
                .sender(headers.getOrDefault("From", UNKNOWN_SENDER))
                .recipient(headers.get("To"))
                .cc(headers.get("Cc"))
                .bcc(headers.get("Bcc"))
                .dateSent(parseDateHeader(headers.get("Date")))
                .dateReceived(message.getInternalDate() != null ? Instant.ofEpochMilli(message.getInternalDate()) : null)
                .bodyText(body.plainTextContent)
                .bodyHtml(body.htmlContent)
                .snippet(message.getSnippet())
                .read(!labelIds.contains("UNREAD"))
                .starred(labelIds.contains("STARRED"))
                .important(labelIds.contains("IMPORTANT"))
                .headers(headers)
                .labelIds(labelIds)
                .attachmentCount(attachmentCount)
                .build();
    }

    private Map<String, String> collectHeaders(MessagePart payload) {
        Map<String, String> headers = new LinkedHashMap<>();
        if (payload == null || payload.getHeaders() == null) {
            return headers;
        }
        for (MessagePartHeader header : payload.getHeaders()) {
            if (header.getName() == null || header.getValue() == null) {
                continue;
            }
            // First occurrence wins, e.g. the topmost Received line.
            headers.putIfAbsent(canonicalName(header.getName()), header.getValue());
        }
        return headers;
    }

    private String canonicalName(String name) {
        switch (name.toLowerCase()) {
            case "subject":
                return "Subject";
            case "from":
                return "From";
            case "to":
                return "To";
            case "cc":
                return "Cc";
            case "bcc":
                return "Bcc";
            case "date":
                return "Date";
            default:
                return name;
        }
    }

    Instant parseDateHeader(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        // Strip a trailing zone comment like "(UTC)" which RFC 1123 parsing rejects.
        String cleaned = value.replaceAll("\\s*\\([^)]*\\)\\s*$", "").trim();
        try {
            return ZonedDateTime.parse(cleaned, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
        } catch (DateTimeParseException e) {
            log.debug("Unparseable Date header '{}': {}", value, e.getMessage());
            return null;
        }
    }

    private static class BodyExtractionResult {
        String htmlContent = null;
        String plainTextContent = null;
    }

    private void extractBodyFromParts(MessagePart part, BodyExtractionResult result) {
        String mimeType = part.getMimeType();
        boolean isAttachment = part.getFilename() != null && !part.getFilename().isEmpty();
        if (!isAttachment && part.getBody() != null && part.getBody().getData() != null
                && ("text/plain".equals(mimeType) || "text/html".equals(mimeType))) {
            String decodedText = decode(part.getBody().getData(), mimeType);
            if (decodedText != null && !decodedText.isEmpty()) {
                if ("text/html".equals(mimeType)) {
                    result.htmlContent = result.htmlContent != null ? result.htmlContent + "\n" + decodedText : decodedText;
                } else {
                    result.plainTextContent = result.plainTextContent != null ? result.plainTextContent + "\n" + decodedText : decodedText;
                }
            }
        }

        if (part.getParts() != null) {
            for (MessagePart subPart : part.getParts()) {
                extractBodyFromParts(subPart, result);
            }
        }
    }

    private String decode(String data, String mimeType) {
        try {
            return new String(Base64.getUrlDecoder().decode(data), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            // Some bodies arrive with standard alphabet or missing padding.
            try {
                String paddedData = data;
                int remainder = paddedData.length() % 4;
                if (remainder > 0) {
                    paddedData += "=".repeat(4 - remainder);
                }
                return new String(Base64.getMimeDecoder().decode(paddedData), StandardCharsets.UTF_8);
            } catch (IllegalArgumentException e2) {
                log.warn("Error decoding email body part (mimeType: {}): {}", mimeType, e2.getMessage());
                return null;
            }
        }
    }

    private int countAttachments(MessagePart part) {
        int count = part.getFilename() != null && !part.getFilename().isEmpty() ? 1 : 0;
        if (part.getParts() != null) {
            for (MessagePart subPart : part.getParts()) {
                count += countAttachments(subPart);
            }
        }
        return count;
    }
}
