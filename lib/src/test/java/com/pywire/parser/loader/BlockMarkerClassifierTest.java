package com.pywire.parser.loader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import com.pywire.parser.loader.BlockMarkerClassifier.BlockMarker;
import org.junit.jupiter.api.Test;

class BlockMarkerClassifierTest {

    @Test
    void openerCarriesKeywordAndExpression() {
        BlockMarker marker = BlockMarkerClassifier.classifyOpener("{$if x > 0}");

        assertEquals("if", marker.keyword());
        assertEquals("x > 0", marker.expression());
    }

    @Test
    void openerWithoutExpression() {
        BlockMarker marker = BlockMarkerClassifier.classifyOpener("{$else}");

        assertEquals("else", marker.keyword());
        assertNull(marker.expression());
    }

    @Test
    void everyKnownKeywordIsRecognized() {
        assertEquals("for", BlockMarkerClassifier.classifyOpener("{$for item in items}").keyword());
        assertEquals("item in items", BlockMarkerClassifier.classifyOpener("{$for item in items}").expression());
        assertEquals("try", BlockMarkerClassifier.classifyOpener("{$try}").keyword());
        assertEquals("await", BlockMarkerClassifier.classifyOpener("{$await load()}").keyword());
        assertEquals("elif", BlockMarkerClassifier.classifyOpener("{$elif y}").keyword());
        assertEquals("finally", BlockMarkerClassifier.classifyOpener("{$finally}").keyword());
        assertEquals("except", BlockMarkerClassifier.classifyOpener("{$except ValueError as e}").keyword());
        assertEquals("then", BlockMarkerClassifier.classifyOpener("{$then value}").keyword());
        assertEquals("catch", BlockMarkerClassifier.classifyOpener("{$catch err}").keyword());
        assertEquals("html", BlockMarkerClassifier.classifyOpener("{$html body}").keyword());
    }

    @Test
    void keywordMatchesByPrefixWithoutWordBoundary() {
        BlockMarker marker = BlockMarkerClassifier.classifyOpener("{$iffy}");

        assertEquals("if", marker.keyword());
        assertEquals("fy", marker.expression());
    }

    @Test
    void firstMatchingKeywordIsStableAcrossRuns() {
        for (int i = 0; i < 5; i++) {
            assertEquals("for", BlockMarkerClassifier.classifyOpener("{$format x}").keyword());
        }
    }

    @Test
    void unknownKeywordLeavesKeywordAndExpressionUnset() {
        BlockMarker marker = BlockMarkerClassifier.classifyOpener("{$while running}");

        assertNull(marker.keyword());
        assertNull(marker.expression());
    }

    @Test
    void leadingSpaceDefeatsKeywordMatch() {
        assertNull(BlockMarkerClassifier.classifyOpener("{$ if x}").keyword());
    }

    @Test
    void onlyTheOuterClosingBraceIsStripped() {
        BlockMarker marker = BlockMarkerClassifier.classifyOpener("{$if data == {}}");

        assertEquals("if", marker.keyword());
        assertEquals("data == {}", marker.expression());
    }

    @Test
    void setLiteralKeepsItsClosingBrace() {
        assertEquals("x in {1, 2}", BlockMarkerClassifier.classifyOpener("{$if x in {1, 2}}").expression());
    }

    @Test
    void noBreakSpacesAroundExpressionAreTrimmed() {
        BlockMarker marker = BlockMarkerClassifier.classifyOpener("{$if\u00A0ready\u202F}");

        assertEquals("if", marker.keyword());
        assertEquals("ready", marker.expression());
    }

    @Test
    void noBreakSpaceOnlyExpressionIsUnset() {
        assertNull(BlockMarkerClassifier.classifyOpener("{$else\u00A0}").expression());
    }

    @Test
    void closerRecordsSlashedKeywordAndNoExpression() {
        BlockMarker marker = BlockMarkerClassifier.classifyCloser("{/if}");

        assertEquals("/if", marker.keyword());
        assertNull(marker.expression());
    }

    @Test
    void closerKeepsUnknownKeywordVerbatim() {
        assertEquals("/while", BlockMarkerClassifier.classifyCloser("{/while}").keyword());
    }
}
