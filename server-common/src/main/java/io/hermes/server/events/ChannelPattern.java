package io.hermes.server.events;

import java.util.Arrays;
import java.util.List;

import io.hermes.spec.InvalidParamsError;

/**
 * A compiled channel pattern.
 * <p>
 * Channel names are dot-delimited. In a pattern, a {@code *} segment matches exactly one
 * segment, so {@code a.*.c} matches {@code a.b.c} but neither {@code a.c} nor {@code a.b.d.c}.
 * When multi-segment wildcards are enabled, a {@code **} segment matches zero or more segments.
 * A pattern without wildcards matches only the identical channel name.
 */
public final class ChannelPattern {

    static final String SINGLE = "*";
    static final String MULTI = "**";

    private final String pattern;
    private final List<String> segments;
    private final boolean literal;

    private ChannelPattern(String pattern, List<String> segments) {
        this.pattern = pattern;
        this.segments = segments;
        this.literal = !segments.contains(SINGLE) && !segments.contains(MULTI);
    }

    /**
     * Parses a pattern.
     *
     * @param pattern the pattern text
     * @param allowMultiSegment whether {@code **} is accepted
     * @throws InvalidParamsError on empty segments, partial wildcards such as {@code ab*}, or
     *         {@code **} when it is not enabled
     */
    public static ChannelPattern compile(String pattern, boolean allowMultiSegment) {
        if (pattern == null || pattern.isBlank()) {
            throw new InvalidParamsError("Channel pattern must not be empty");
        }
        List<String> segments = Arrays.asList(pattern.split("\\.", -1));
        for (String segment : segments) {
            if (segment.isEmpty()) {
                throw new InvalidParamsError("Channel pattern has an empty segment: " + pattern);
            }
            if (segment.equals(MULTI)) {
                if (!allowMultiSegment) {
                    throw new InvalidParamsError("Multi-segment wildcards are not enabled: " + pattern);
                }
            } else if (!segment.equals(SINGLE) && segment.contains(SINGLE)) {
                throw new InvalidParamsError("A wildcard must be a whole segment: " + pattern);
            }
        }
        return new ChannelPattern(pattern, List.copyOf(segments));
    }

    public String pattern() {
        return pattern;
    }

    public boolean isLiteral() {
        return literal;
    }

    public boolean matches(String channel) {
        if (literal) {
            return pattern.equals(channel);
        }
        return matches(0, channel.split("\\.", -1), 0);
    }

    private boolean matches(int patternIndex, String[] channel, int channelIndex) {
        if (patternIndex == segments.size()) {
            return channelIndex == channel.length;
        }
        String segment = segments.get(patternIndex);
        if (segment.equals(MULTI)) {
            for (int next = channelIndex; next <= channel.length; next++) {
                if (matches(patternIndex + 1, channel, next)) {
                    return true;
                }
            }
            return false;
        }
        if (channelIndex == channel.length) {
            return false;
        }
        if (!segment.equals(SINGLE) && !segment.equals(channel[channelIndex])) {
            return false;
        }
        return matches(patternIndex + 1, channel, channelIndex + 1);
    }

    @Override
    public String toString() {
        return pattern;
    }
}
