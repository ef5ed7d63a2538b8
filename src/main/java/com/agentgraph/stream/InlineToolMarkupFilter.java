package com.agentgraph.stream;

import java.util.List;
import java.util.Locale;

/**
 * Strips inline tool-call markup such as {@code <tool_call>...</tool_call>} from
 * streamed text. Text that may still turn into markup (an open tag without its
 * close tag, or a trailing partial {@code <tool_ca}) stays in the buffer until
 * more input arrives.
 */
public final class InlineToolMarkupFilter {

    private final List<String> openTokens;
    private final List<String> closeTokens;
    private final int longestOpenToken;

    public InlineToolMarkupFilter(List<String> tagNames) {
        this.openTokens = tagNames.stream().map(tag -> "<" + tag.toLowerCase(Locale.ROOT)).toList();
        this.closeTokens = tagNames.stream().map(tag -> "</" + tag.toLowerCase(Locale.ROOT) + ">").toList();
        this.longestOpenToken = openTokens.stream().mapToInt(String::length).max().orElse(0);
    }

    /**
     * Removes everything that is safe to emit from {@code buffer} and returns it.
     *
     * @param endOfStream no more text will follow: held-back partial tags are released
     *                    and an unterminated markup block is dropped
     */
    public String drain(StringBuilder buffer, boolean endOfStream) {
        if (buffer.length() == 0) {
            return "";
        }
        if (openTokens.isEmpty()) {
            String all = buffer.toString();
            buffer.setLength(0);
            return all;
        }
        StringBuilder out = new StringBuilder();
        String text = buffer.toString();
        while (!text.isEmpty()) {
            int openAt = -1;
            int tagIndex = -1;
            for (int i = 0; i < openTokens.size(); i++) {
                int at = indexOfIgnoreCase(text, openTokens.get(i), 0);
                if (at >= 0 && (openAt < 0 || at < openAt)) {
                    openAt = at;
                    tagIndex = i;
                }
            }
            if (openAt < 0) {
                int hold = endOfStream ? 0 : partialSuffixLength(text);
                out.append(text, 0, text.length() - hold);
                text = text.substring(text.length() - hold);
                break;
            }
            out.append(text, 0, openAt);
            String close = closeTokens.get(tagIndex);
            int closeAt = indexOfIgnoreCase(text, close, openAt + openTokens.get(tagIndex).length());
            if (closeAt < 0) {
                text = endOfStream ? "" : text.substring(openAt);
                break;
            }
            text = text.substring(closeAt + close.length());
        }
        buffer.setLength(0);
        buffer.append(text);
        return out.toString();
    }

    // Offsets index the original text, not a case-folded copy.
    private static int indexOfIgnoreCase(String text, String token, int from) {
        for (int at = from; at <= text.length() - token.length(); at++) {
            if (text.regionMatches(true, at, token, 0, token.length())) {
                return at;
            }
        }
        return -1;
    }

    private int partialSuffixLength(String text) {
        int max = Math.min(text.length(), longestOpenToken - 1);
        for (int length = max; length > 0; length--) {
            for (String token : openTokens) {
                if (token.length() > length
                        && text.regionMatches(true, text.length() - length, token, 0, length)) {
                    return length;
                }
            }
        }
        return 0;
    }
}
