package com.questrail.busanomaly.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Tensor
 * -----------------------------------------------------------------------------
 * An ordered collection of {@code N} sequences, each holding exactly {@code P}
 * {@link Word}s of {@code W} bits.
 *
 * <h2>Layout</h2>
 * Words are stored flat in row-major order: sequence-major, then word order.
 * {@link #flatten()} exposes this order directly and {@link #reshape} is its
 * inverse, which is what the interleave and reverse transforms are defined
 * over.
 *
 * <h2>Mutability</h2>
 * A {@code Tensor} is immutable and so are its words. Transforms build a new
 * tensor; the input is never changed.
 */
public final class Tensor
{
    private final Word[] words;
    private final TensorShape shape;

    private Tensor(Word[] words, TensorShape shape) {
        this.words = words;
        this.shape = shape;
    }

    /**
     * Builds a tensor from a flat, row-major list of words.
     *
     * @throws TensorShapeException if the word count is not {@code N * P} or
     *         any word is not {@code W} bits wide
     */
    public static Tensor reshape(List<Word> flat, TensorShape shape) {
        Objects.requireNonNull(flat, "flat");
        Objects.requireNonNull(shape, "shape");

        if (flat.size() != shape.totalWords()) {
            throw new TensorShapeException(
                    "Cannot reshape " + flat.size() + " words into " + shape);
        }

        Word[] copy = new Word[flat.size()];
        for (int i = 0; i < copy.length; i++) {
            Word w = Objects.requireNonNull(flat.get(i), "word at index " + i);
            if (w.width() != shape.bitsPerWord()) {
                throw new TensorShapeException(
                        "Word " + i + " has " + w.width() + " bits, expected " + shape.bitsPerWord());
            }
            copy[i] = w;
        }
        return new Tensor(copy, shape);
    }

    /**
     * Builds a tensor from nested sequences. All sequences must have the same
     * length and all words the same width.
     */
    public static Tensor of(List<List<Word>> sequences) {
        Objects.requireNonNull(sequences, "sequences");
        if (sequences.isEmpty()) {
            throw new TensorShapeException("At least one sequence is required to infer a shape");
        }

        int p = sequences.get(0).size();
        int w = p == 0 ? 0 : sequences.get(0).get(0).width();

        List<Word> flat = new ArrayList<>(sequences.size() * p);
        for (int i = 0; i < sequences.size(); i++) {
            List<Word> seq = sequences.get(i);
            if (seq.size() != p) {
                throw new TensorShapeException(
                        "Sequence " + i + " has " + seq.size() + " words, expected " + p);
            }
            flat.addAll(seq);
        }
        return reshape(flat, new TensorShape(sequences.size(), p, w));
    }

    public TensorShape shape() {
        return shape;
    }

    public int sequenceCount() {
        return shape.sequences();
    }

    public int wordsPerSequence() {
        return shape.wordsPerSequence();
    }

    public int bitsPerWord() {
        return shape.bitsPerWord();
    }

    public Word word(int sequence, int position) {
        if (sequence < 0 || sequence >= shape.sequences()) {
            throw new IndexOutOfBoundsException("sequence=" + sequence + ", shape=" + shape);
        }
        if (position < 0 || position >= shape.wordsPerSequence()) {
            throw new IndexOutOfBoundsException("position=" + position + ", shape=" + shape);
        }
        return words[sequence * shape.wordsPerSequence() + position];
    }

    /**
     * Returns one sequence as an unmodifiable list.
     */
    public List<Word> sequence(int sequence) {
        if (sequence < 0 || sequence >= shape.sequences()) {
            throw new IndexOutOfBoundsException("sequence=" + sequence + ", shape=" + shape);
        }
        int p = shape.wordsPerSequence();
        List<Word> out = new ArrayList<>(p);
        for (int j = 0; j < p; j++) {
            out.add(words[sequence * p + j]);
        }
        return Collections.unmodifiableList(out);
    }

    /**
     * Returns every word in row-major order. The list is a fresh, modifiable
     * copy.
     */
    public List<Word> flatten() {
        List<Word> out = new ArrayList<>(words.length);
        Collections.addAll(out, words);
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Tensor)) {
            return false;
        }
        Tensor other = (Tensor) o;
        return shape.equals(other.shape) && Arrays.equals(words, other.words);
    }

    @Override
    public int hashCode() {
        return 31 * shape.hashCode() + Arrays.hashCode(words);
    }

    @Override
    public String toString() {
        return "Tensor" + shape;
    }
}
