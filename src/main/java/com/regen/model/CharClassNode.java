package com.regen.model;

import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.Value;

/**
 * A character class holding sorted, non-overlapping, non-adjacent inclusive ranges.
 * Use {@link com.regen.parser.CharClassBuilder} to construct a normalized instance.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class CharClassNode extends RegexNode {
    List<RuneRange> ranges;

    public CharClassNode(List<RuneRange> ranges) {
        this.ranges = List.copyOf(ranges);
    }

    /**
     * Total number of code points in the class, summed over every range.
     */
    public long size() {
        long total = 0;
        for (RuneRange range : ranges) {
            total += range.size();
        }
        return total;
    }

    public boolean isEmpty() {
        return ranges.isEmpty();
    }

    public boolean contains(int rune) {
        for (RuneRange range : ranges) {
            if (range.contains(rune)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public <R> R accept(RegexNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
