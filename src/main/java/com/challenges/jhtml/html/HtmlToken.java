package com.challenges.jhtml.html;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * One lexical event of an HTML document.
 */
public sealed interface HtmlToken {

    enum Kind {
        START_TAG,
        END_TAG,
        SELF_CLOSING_TAG,
        TEXT,
        COMMENT,
        DOCTYPE,
        END_OF_STREAM
    }

    Kind kind();

    /** Attribute lists keep source order and may repeat a key. */
    record Attribute(String key, String value) {}

    record StartTag(String name, MutableList<Attribute> attributes) implements HtmlToken {
        public static StartTag of(String name, Attribute... attributes) {
            return new StartTag(name, Lists.mutable.with(attributes));
        }

        @Override
        public Kind kind() {
            return Kind.START_TAG;
        }
    }

    record SelfClosingTag(String name, MutableList<Attribute> attributes) implements HtmlToken {
        public static SelfClosingTag of(String name, Attribute... attributes) {
            return new SelfClosingTag(name, Lists.mutable.with(attributes));
        }

        @Override
        public Kind kind() {
            return Kind.SELF_CLOSING_TAG;
        }
    }

    record EndTag(String name) implements HtmlToken {
        @Override
        public Kind kind() {
            return Kind.END_TAG;
        }
    }

    record Text(String text) implements HtmlToken {
        @Override
        public Kind kind() {
            return Kind.TEXT;
        }
    }

    record Comment(String text) implements HtmlToken {
        @Override
        public Kind kind() {
            return Kind.COMMENT;
        }
    }

    record Doctype(String text) implements HtmlToken {
        @Override
        public Kind kind() {
            return Kind.DOCTYPE;
        }
    }

    record EndOfStream() implements HtmlToken {
        @Override
        public Kind kind() {
            return Kind.END_OF_STREAM;
        }
    }
}
