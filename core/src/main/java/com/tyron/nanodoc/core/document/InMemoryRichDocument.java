package com.tyron.nanodoc.core.document;

import com.tyron.nanodoc.api.attributes.Attribute;
import com.tyron.nanodoc.api.delta.Delta;
import com.tyron.nanodoc.api.delta.Embed;
import com.tyron.nanodoc.api.delta.Operation;
import com.tyron.nanodoc.api.document.ChangeSource;
import com.tyron.nanodoc.api.document.DocumentChangeEvent;
import com.tyron.nanodoc.api.document.DocumentChangeListener;
import com.tyron.nanodoc.api.document.ObservableRichDocument;
import com.tyron.nanodoc.core.rules.FormatRules;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Simple in-memory {@link ObservableRichDocument} implementation.
 *
 * Holds the authoritative content as a {@link Delta} and composes every change into it.
 * Changes are validated before they are committed: a change that would leave the content
 * without its trailing newline, or with anything but inserts, is rejected and the document
 * stays untouched.
 *
 * Thread-safety: all operations are synchronized on an internal lock. Listeners are
 * notified outside the lock, on the calling thread.
 */
public final class InMemoryRichDocument implements ObservableRichDocument {

    private final Object lock = new Object();
    private final FormatRules rules;
    private final CopyOnWriteArrayList<DocumentChangeListener> listeners = new CopyOnWriteArrayList<>();

    private Delta content;
    private volatile long modificationStamp;

    public InMemoryRichDocument() {
        this(new Delta().insert("\n"));
    }

    public InMemoryRichDocument(@NotNull Delta content) {
        this(content, FormatRules.getDefault());
    }

    public InMemoryRichDocument(@NotNull Delta content, @NotNull FormatRules rules) {
        Objects.requireNonNull(content, "content");
        this.rules = Objects.requireNonNull(rules, "rules");
        if (!isValidDocument(content)) {
            throw new IllegalArgumentException("Document content must be inserts ending with a newline: " + content);
        }
        this.content = Delta.copyOf(content);
    }

    /**
     * Creates a document holding plain text. A trailing newline is appended if missing.
     */
    public static InMemoryRichDocument fromText(@Nullable String text) {
        String value = text != null ? text : "";
        if (!value.endsWith("\n")) {
            value = value + "\n";
        }
        return new InMemoryRichDocument(new Delta().insert(value));
    }

    @Override
    public Delta toDelta() {
        synchronized (lock) {
            return Delta.copyOf(content);
        }
    }

    @Override
    public int length() {
        synchronized (lock) {
            return content.length();
        }
    }

    @Override
    public String toPlainText() {
        synchronized (lock) {
            return content.toPlainText();
        }
    }

    public FormatRules getRules() {
        return rules;
    }

    @Override
    public Delta format(int index, int length, Attribute attribute) {
        return format(index, length, attribute, null);
    }

    @Override
    public Delta format(int index, int length, Attribute attribute, @Nullable Object data) {
        Objects.requireNonNull(attribute, "attribute");

        DocumentChangeEvent event;
        Delta change;
        synchronized (lock) {
            change = rules.apply(content, index, length, attribute, data);
            event = commit(change, ChangeSource.LOCAL);
        }
        fire(event);
        return change;
    }

    @Override
    public Delta insert(int index, String text, @Nullable Map<String, ?> attributes) {
        Objects.requireNonNull(text, "text");
        if (text.isEmpty()) {
            return new Delta();
        }
        return applyLocal(index, 0, new Delta().retain(index).insert(text, attributes));
    }

    @Override
    public Delta insert(int index, Embed embed, @Nullable Map<String, ?> attributes) {
        Objects.requireNonNull(embed, "embed");
        return applyLocal(index, 0, new Delta().retain(index).insert(embed, attributes));
    }

    @Override
    public Delta delete(int index, int length) {
        if (length == 0) {
            return new Delta();
        }
        return applyLocal(index, length, new Delta().retain(index).delete(length));
    }

    @Override
    public void compose(Delta change, ChangeSource source) {
        Objects.requireNonNull(change, "change");
        Objects.requireNonNull(source, "source");

        DocumentChangeEvent event;
        synchronized (lock) {
            event = commit(change, source);
        }
        fire(event);
    }

    /**
     * Applies a change that edits [index, index + length); the range must stay before the final newline.
     */
    private Delta applyLocal(int index, int length, Delta change) {
        DocumentChangeEvent event;
        synchronized (lock) {
            int max = content.length() - 1;
            if (index < 0 || length < 0 || index > max - length) {
                throw new IndexOutOfBoundsException("range [" + index + ", " + (index + length)
                        + ") is out of bounds for editable length=" + max);
            }
            event = commit(change, ChangeSource.LOCAL);
        }
        fire(event);
        return change;
    }

    private DocumentChangeEvent commit(Delta change, ChangeSource source) {
        Delta before = content;
        Delta after = before.compose(change);
        if (!isValidDocument(after)) {
            throw new IllegalStateException("Change " + change + " does not produce a valid document");
        }
        content = after;
        modificationStamp++;
        return new DocumentChangeEvent(this, Delta.copyOf(before), Delta.copyOf(change), source);
    }

    private void fire(DocumentChangeEvent event) {
        for (DocumentChangeListener listener : listeners) {
            listener.documentChanged(event);
        }
    }

    private static boolean isValidDocument(Delta delta) {
        if (delta.isEmpty() || !delta.isDocument()) {
            return false;
        }
        Operation last = delta.last();
        return last != null && last.getText().endsWith("\n");
    }

    @Override
    public void addDocumentChangeListener(DocumentChangeListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    @Override
    public void removeDocumentChangeListener(DocumentChangeListener listener) {
        listeners.remove(listener);
    }

    @Override
    public long getModificationStamp() {
        return modificationStamp;
    }
}
