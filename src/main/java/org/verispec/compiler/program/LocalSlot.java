package org.verispec.compiler.program;

/**
 * Index of a local variable within an element body. Slot 0 of a closure body
 * is the closure environment itself.
 *
 * @param index The zero-based slot index.
 */
public record LocalSlot(int index) implements Comparable<LocalSlot> {

    public LocalSlot {
        if (index < 0) {
            throw new IllegalArgumentException("Local slot index must not be negative: " + index);
        }
    }

    @Override
    public int compareTo(LocalSlot other) {
        return Integer.compare(index, other.index);
    }

    @Override
    public String toString() {
        return "_" + index;
    }
}
