package com.pywire.parser.loader.ast;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TemplateNodeTest {
    private static final SourcePosition START = new SourcePosition(1, 0);

    @Test
    void attributeMapUsesReservedKeysAndKeepsFirstOrder() {
        TemplateNode node =
                TemplateNode.builder(START)
                        .tag("input")
                        .attribute(new PlainAttributeNode("value", "a"))
                        .attribute(new ShorthandAttributeNode("name", "{name}"))
                        .attribute(new PlainAttributeNode("required", null))
                        .attribute(new PlainAttributeNode("value", "b"))
                        .build();

        Map<String, String> map = node.attributeMap();

        assertEquals(List.of("value", "__pw_sh_name", "required"), List.copyOf(map.keySet()));
        assertEquals("b", map.get("value"));
        assertEquals("{name}", map.get("__pw_sh_name"));
        assertTrue(map.containsKey("required"));
        assertNull(map.get("required"));
        assertEquals(4, node.getAttributes().size());
    }

    @Test
    void nodeListsAreImmutable() {
        TemplateNode node = TemplateNode.builder(START).tag("p").build();

        assertThrows(UnsupportedOperationException.class, () -> node.getChildren().add(node));
        assertThrows(UnsupportedOperationException.class, () -> node.attributeMap().put("x", "y"));
    }

    @Test
    void blockFlagsDistinguishOpenersClosersAndInterpolations() {
        TemplateNode opener = TemplateNode.builder(START).block("for", "x in xs").build();
        TemplateNode closer = TemplateNode.builder(START).block("/for", null).build();
        TemplateNode interpolation =
                TemplateNode.builder(START).block(TemplateNode.INTERPOLATION_KEYWORD, "x").build();

        assertFalse(opener.isBlockCloser());
        assertFalse(opener.isInterpolation());
        assertTrue(closer.isBlockCloser());
        assertTrue(interpolation.isInterpolation());
        assertFalse(interpolation.isElement());
    }

    @Test
    void spreadExpressionDropsBracesAndStars() {
        assertEquals("attrs", new SpreadAttributeNode("{**attrs}").getExpression());
        assertEquals("dict(a=1)", new SpreadAttributeNode("{ ** dict(a=1) }").getExpression());
    }

    @Test
    void positionsRejectInvalidCoordinates() {
        assertThrows(IllegalArgumentException.class, () -> new SourcePosition(0, 0));
        assertThrows(IllegalArgumentException.class, () -> new SourcePosition(1, -1));
        assertEquals(new SourcePosition(3, 7), new SourcePosition(3, 7));
    }
}
