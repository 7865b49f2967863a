package com.endecrelay.core.decode;

import com.endecrelay.core.model.AlertBlock;
import com.endecrelay.core.model.EasHeader;
import com.endecrelay.core.model.ResolvedAlert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Splits an {@link AlertBlock} into message text and an optional EAS header.
 *
 * <h3>Resolution order</h3>
 * <ol>
 * <li><b>Single line</b> - the first line that is exactly a header is
 * removed; the remaining lines, joined with single spaces, are the
 * message.</li>
 * <li><b>Fragmented or embedded</b> - all lines are concatenated with no
 * separator and searched for a header. The message keeps, per original
 * line, only the characters outside the header's span, so a header split
 * mid-field across two serial lines is still removed cleanly.</li>
 * <li><b>No header</b> - the whole block, joined with spaces, is the
 * message.</li>
 * </ol>
 *
 * <p>
 * If a header was found but no text remains, the message becomes the event
 * name. When several headers are present the first one wins.
 * </p>
 *
 * @since 1.0.0
 */
public final class BlockResolver {

    private static final Logger LOG = LoggerFactory.getLogger(BlockResolver.class);

    private final EasHeaderParser parser;

    public BlockResolver(EasHeaderParser parser) {
        this.parser = Objects.requireNonNull(parser, "EasHeaderParser must not be null");
    }

    /**
     * Resolve a block.
     *
     * @param block block produced by the frame assembler; must not be
     *              {@code null}
     * @return the resolved alert, or empty if there is nothing to dispatch
     */
    public Optional<ResolvedAlert> resolve(AlertBlock block) {
        Objects.requireNonNull(block, "AlertBlock must not be null");
        List<String> lines = block.getLines();

        ResolvedAlert resolved = resolveSingleLine(lines)
                .or(() -> resolveFragmented(lines))
                .orElseGet(() -> new ResolvedAlert(join(lines), null));

        if (resolved.getMessageText().isEmpty()) {
            if (!resolved.hasHeader()) {
                LOG.debug("Block resolved to nothing; skipping");
                return Optional.empty();
            }
            EasHeader header = resolved.getHeader().get();
            resolved = new ResolvedAlert(header.getEventName(), header);
        }
        return Optional.of(resolved);
    }

    // ---------------------------------------------------------------
    // Strategies
    // ---------------------------------------------------------------

    private Optional<ResolvedAlert> resolveSingleLine(List<String> lines) {
        for (int i = 0; i < lines.size(); i++) {
            Optional<EasHeader> header = parser.parse(lines.get(i));
            if (header.isPresent()) {
                List<String> remainder = new ArrayList<>(lines);
                remainder.remove(i);
                LOG.debug("Header found on line {}: {}", i, header.get().getRawHeader());
                return Optional.of(new ResolvedAlert(join(remainder), header.get()));
            }
        }
        return Optional.empty();
    }

    private Optional<ResolvedAlert> resolveFragmented(List<String> lines) {
        String concatenated = String.join("", lines);
        Optional<HeaderMatch> found = parser.find(concatenated);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        HeaderMatch match = found.get();
        LOG.info("Recovered fragmented/embedded header at [{}, {}): {}",
                match.getStart(), match.getEnd(), match.getHeader().getRawHeader());

        List<String> fragments = new ArrayList<>();
        int offset = 0;
        for (String line : lines) {
            int lineStart = offset;
            int lineEnd = offset + line.length();
            offset = lineEnd;

            // part of the line before the header span
            int beforeEnd = Math.min(lineEnd, match.getStart());
            if (beforeEnd > lineStart) {
                fragments.add(line.substring(0, beforeEnd - lineStart));
            }
            // part of the line after the header span
            int afterStart = Math.max(lineStart, match.getEnd());
            if (afterStart < lineEnd) {
                fragments.add(line.substring(afterStart - lineStart));
            }
        }
        return Optional.of(new ResolvedAlert(join(fragments), match.getHeader()));
    }

    private static String join(List<String> parts) {
        List<String> kept = new ArrayList<>(parts.size());
        for (String part : parts) {
            String stripped = part.strip();
            if (!stripped.isEmpty()) {
                kept.add(stripped);
            }
        }
        return String.join(" ", kept);
    }
}
