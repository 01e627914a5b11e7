package org.pokersight.model.poker.rules;

import org.junit.jupiter.api.Test;
import org.pokersight.model.poker.rules.StackRules.StackParse;

import static org.assertj.core.api.Assertions.assertThat;

class StackRulesTest {

    // --------------------------------------------------------------
    // parseStack
    // --------------------------------------------------------------
    @Test
    void parseStack_chipShapes() {
        assertThat(StackRules.parseStack("1,500").chips()).isEqualTo(1500L);
        assertThat(StackRules.parseStack("12.5K").chips()).isEqualTo(12500L);
        assertThat(StackRules.parseStack("1,500K").chips()).isEqualTo(1_500_000L);
        assertThat(StackRules.parseStack("1,500 k").chips()).isEqualTo(1_500_000L);
        assertThat(StackRules.parseStack("3k").chips()).isEqualTo(3000L);
        assertThat(StackRules.parseStack("Stack 875").chips()).isEqualTo(875L);
    }

    @Test
    void parseStack_bbAnnotationIsNotReadAsChips() {
        StackParse both = StackRules.parseStack("1500 (30 BB)");
        assertThat(both.status()).isEqualTo(StackParse.Status.PARSED);
        assertThat(both.chips()).isEqualTo(1500L);
        assertThat(both.bbSize()).isEqualTo(30.0);

        StackParse bbOnly = StackRules.parseStack("22.5 bb");
        assertThat(bbOnly.status()).isEqualTo(StackParse.Status.BB_ONLY);
        assertThat(bbOnly.hasChips()).isFalse();
        assertThat(bbOnly.bbSize()).isEqualTo(22.5);
    }

    @Test
    void parseStack_blankAndGarbage() {
        assertThat(StackRules.parseStack(" ").status()).isEqualTo(StackParse.Status.NOT_RECOGNIZED);
        assertThat(StackRules.parseStack(null).status()).isEqualTo(StackParse.Status.NOT_RECOGNIZED);
        StackParse junk = StackRules.parseStack("Sitting Out");
        assertThat(junk.status()).isEqualTo(StackParse.Status.UNPARSEABLE);
        assertThat(junk.chips()).isNull();
    }

    // --------------------------------------------------------------
    // parseBlinds / parsePot
    // --------------------------------------------------------------
    @Test
    void parseBlinds_readsPairs() {
        assertThat(StackRules.parseBlinds("25/50")).contains(new StackRules.Blinds(25, 50));
        assertThat(StackRules.parseBlinds("Blinds: 1K / 2K")).contains(new StackRules.Blinds(1000, 2000));
        assertThat(StackRules.parseBlinds("1,000/2,000")).contains(new StackRules.Blinds(1000, 2000));
    }

    @Test
    void parseBlinds_rejectsInvertedOrMissing() {
        assertThat(StackRules.parseBlinds("100/50")).isEmpty();
        assertThat(StackRules.parseBlinds("0/50")).isEmpty();
        assertThat(StackRules.parseBlinds("level 4")).isEmpty();
        assertThat(StackRules.parseBlinds(null)).isEmpty();
    }

    @Test
    void parsePot_isLenient() {
        assertThat(StackRules.parsePot("$52.20")).contains(52.2);
        assertThat(StackRules.parsePot("Pot: 1,250")).contains(1250.0);
        assertThat(StackRules.parsePot("pot")).isEmpty();
        assertThat(StackRules.parsePot("")).isEmpty();
    }
}
