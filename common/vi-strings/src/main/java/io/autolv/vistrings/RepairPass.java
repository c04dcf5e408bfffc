package io.autolv.vistrings;

import java.util.BitSet;
import java.util.List;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One rewrite of exported VI strings towards well-formed XML.
 * <p>
 * The passes only make sense in declaration order: quoting assumes the free text of {@code Text} parts
 * is gone, closing and escaping assume embedded markup has been collapsed, and the CDATA conversion
 * assumes escapes are already standard. Every pass leaves already repaired text untouched.
 */
public enum RepairPass implements UnaryOperator<String> {

    /** Drops the free text of {@code <PART type="Text">}; it may hold anything and is never used. */
    STRIP_PART_TEXT {
        private final Pattern textPart =
            Pattern.compile("(<PART\\b[^>]*?type=\"Text\">)(.*?)(</PART>)", Pattern.DOTALL);

        @Override
        public String apply(String text) {
            return textPart.matcher(text).replaceAll(m -> Matcher.quoteReplacement(m.group(1) + m.group(3)));
        }
    },

    /** {@code key=value} becomes {@code key="value"} inside start tags; element text is left alone. */
    QUOTE_ATTRIBUTES {
        private final Pattern startTag = Pattern.compile("<[A-Za-z_][^<>]*>");
        private final Pattern bareValue = Pattern.compile("(?<=\\w)=(?!\")([^\\s>\"]*)([\\s>])");

        @Override
        public String apply(String text) {
            return startTag.matcher(text).replaceAll(tag -> Matcher.quoteReplacement(quote(tag.group())));
        }

        private String quote(String tag) {
            return bareValue.matcher(tag)
                .replaceAll(m -> Matcher.quoteReplacement("=\"" + m.group(1) + "\"" + m.group(2)));
        }
    },

    /**
     * Collapses escaped style markers ({@code <<B>>} to {@code <B>}) and turns {@code <<digits>>} into the
     * {@code __digits__} placeholder.
     */
    DE_EMBED_ELEMENTS {
        private final List<Pattern> embedded = List.of(
            Pattern.compile("<(</?B>)>"),
            Pattern.compile("<(</?append>)>"));
        private final Pattern placeholder = Pattern.compile("<<([0-9]+)>>");

        @Override
        public String apply(String text) {
            String result = text;
            for (Pattern pattern : embedded) {
                result = pattern.matcher(result).replaceAll(m -> Matcher.quoteReplacement(m.group(1)));
            }
            return placeholder.matcher(result).replaceAll(m -> Matcher.quoteReplacement("__" + m.group(1) + "__"));
        }
    },

    /** Adds the closing tag LabVIEW never writes for its empty marker elements. */
    CLOSE_ELEMENTS {
        private final List<Pattern> openers = Unclosed.NAMES.stream()
            .map(name -> Pattern.compile("<" + name + "\\b[^>]*?(?<!/)>(?!</" + name + ">)"))
            .toList();

        @Override
        public String apply(String text) {
            String result = text;
            for (int i = 0; i < openers.size(); i++) {
                String closer = "</" + Unclosed.NAMES.get(i) + ">";
                result = openers.get(i).matcher(result).replaceAll(m -> Matcher.quoteReplacement(m.group() + closer));
            }
            return result;
        }
    },

    /**
     * Rewrites LabVIEW's own escapes as XML entities: {@code <<} and {@code >>} everywhere, a bare
     * {@code &} and a doubled {@code "} only outside tags.
     */
    PREDEFINED_ENTITIES {
        private final Pattern lessThan = Pattern.compile("<<");
        private final Pattern greaterThan = Pattern.compile(">>(?!>)");
        private final Pattern tagSpan = Pattern.compile("<!\\[CDATA\\[(?s:.*?)]]>|<[^<]/?.*?[^>]>");
        private final Pattern escape = Pattern.compile("&(?!(?:lt|gt|amp|quot|apos|#[0-9]+|#x[0-9a-fA-F]+);)|\"\"");

        @Override
        public String apply(String text) {
            String result = lessThan.matcher(text).replaceAll("&lt;");
            result = greaterThan.matcher(result).replaceAll("&gt;");

            BitSet inTag = new BitSet(result.length());
            Matcher tags = tagSpan.matcher(result);
            while (tags.find()) {
                inTag.set(tags.start(), tags.end());
            }

            Matcher matcher = escape.matcher(result);
            StringBuilder out = new StringBuilder(result.length() + 16);
            while (matcher.find()) {
                if (inTag.get(matcher.start())) {
                    continue;
                }
                String entity = matcher.group().equals("&") ? "&amp;" : "&quot;";
                matcher.appendReplacement(out, entity);
            }
            matcher.appendTail(out);
            return out.toString();
        }
    },

    /** {@code <B>text</B>} becomes a CDATA section so its content needs no escaping. */
    STYLED_TEXT_CDATA {
        private final Pattern bold = Pattern.compile("<B>(.*?)</B>");

        @Override
        public String apply(String text) {
            return bold.matcher(text).replaceAll(m -> Matcher.quoteReplacement("<![CDATA[" + m.group(1) + "]]>"));
        }
    };

    /** Elements exported as bare opening tags. */
    public static final List<String> UNCLOSED_ELEMENTS = Unclosed.NAMES;

    // enum constants are built before the enum's own static fields
    private static final class Unclosed {
        static final List<String> NAMES =
            List.of("NO_TITLE", "FONT", "LF", "CRLF", "SAME_AS_LABEL", "append", "NON_STRING", "SEP");
    }
}
