package com.endecrelay.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * An alert ready for dispatch: human-readable message text plus the parsed
 * EAS header, if one was found in the block.
 *
 * <p>
 * When a header is present the message text never contains the header's
 * characters. When it is absent the message text is the full block.
 * </p>
 *
 * @since 1.0.0
 */
public final class ResolvedAlert {

    private final String messageText;
    private final EasHeader header;

    public ResolvedAlert(String messageText, EasHeader header) {
        this.messageText = Objects.requireNonNull(messageText, "messageText must not be null");
        this.header = header;
    }

    public String getMessageText() {
        return messageText;
    }

    /**
     * @return the parsed header, or empty for a plain-text bulletin
     */
    public Optional<EasHeader> getHeader() {
        return Optional.ofNullable(header);
    }

    public boolean hasHeader() {
        return header != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ResolvedAlert that))
            return false;
        return messageText.equals(that.messageText) && Objects.equals(header, that.header);
    }

    @Override
    public int hashCode() {
        return Objects.hash(messageText, header);
    }

    @Override
    public String toString() {
        return "ResolvedAlert{" +
                "messageText='" + messageText + '\'' +
                ", header=" + header +
                '}';
    }
}
