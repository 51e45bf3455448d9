package org.polyast.core.token;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link Token}, {@link Tokens} and {@link TokenRange}.
 */
@Tag("unit")
class TokenTest {

    private static final SourceLocation AT_10 = new SourceLocation("main.c", 2, 4, 10);

    @Test
    void newToken_isOriginalWithoutTransformation() {
        Token token = new Token("foo", AT_10);

        assertThat(token.origin()).isEqualTo(Origin.ORIGINAL);
        assertThat(token.isExpanded()).isFalse();
        assertThat(token.transformation()).isEqualTo(Transformation.NONE);
        assertThat(token.originalLocation()).isEqualTo(AT_10);
        assertThat(token.toString()).isEqualTo("'foo'@main.c:2:4");
    }

    @Test
    void constructor_rejectsNullLocation() {
        assertThatThrownBy(() -> new Token("foo", null))
            .isInstanceOf(NullPointerException.class)
            .hasMessage("location");
    }

    @Test
    void transformation_isWritableSlot() {
        Token token = new Token("foo", AT_10);

        token.setTransformation(new Transformation.Replace("bar"));

        assertThat(token.transformation()).isEqualTo(new Transformation.Replace("bar"));
        assertThat(token.text()).isEqualTo("foo");
    }

    @Test
    void makeExpanded_pointsBackToOriginalLocation() {
        Token source = new Token("MAX", AT_10);

        Token expanded = Tokens.makeExpanded(source);

        assertThat(expanded.isExpanded()).isTrue();
        assertThat(expanded.location()).isEqualTo(SourceLocation.none());
        assertThat(expanded.originalLocation()).isEqualTo(AT_10);
        assertThat(source.isExpanded()).isFalse();
    }

    @Test
    void makeExpanded_keepsTextAndScheduledTransformation() {
        Token source = new Token("MAX", new SourceLocation("a.c", 3, 4, 40));
        source.setTransformation(new Transformation.Remove());

        Token expanded = Tokens.makeExpanded(source);

        assertThat(expanded.text()).isEqualTo("MAX");
        assertThat(expanded.transformation()).isEqualTo(new Transformation.Remove());
        assertThat(expanded.originalLocation()).isEqualTo(source.location());
    }

    @Test
    void makeExpanded_ofExpandedToken_keepsFirstOrigin() {
        Token twice = Tokens.makeExpanded(Tokens.makeExpanded(new Token("MAX", AT_10)));

        assertThat(twice.originalLocation()).isEqualTo(AT_10);
    }

    @Test
    void rewrap_keepsTextLocationAndTransformation() {
        Token token = new Token("x", AT_10);
        token.setTransformation(new Transformation.Remove());
        Origin origin = new Origin.Expanded(new SourceLocation("m.h", 1, 0, 0), List.of("M"));

        Token copy = Tokens.rewrap(origin, token);

        assertThat(copy).isNotSameAs(token);
        assertThat(copy.text()).isEqualTo("x");
        assertThat(copy.location()).isEqualTo(AT_10);
        assertThat(copy.origin()).isEqualTo(origin);
        assertThat(copy.transformation()).isEqualTo(new Transformation.Remove());
    }

    @Test
    void unwrapHelpers_returnValues() {
        Token open = new Token("(", AT_10);
        Token close = new Token(")", new SourceLocation("main.c", 2, 8, 14));

        assertThat(Tokens.unwrap(Wrap.of(42, open))).isEqualTo(42);
        assertThat(Tokens.unparen(Delimited.of(open, "e", close))).isEqualTo("e");
        assertThat(Tokens.unbrace(Delimited.of(open, List.of(), close))).isEmpty();
    }

    @Test
    void wrap_rejectsMissingToken() {
        assertThatThrownBy(() -> Wrap.of("x", null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void range_skipsExpandedAndUnlocatedTokens() {
        Token a = new Token("a", new SourceLocation("f.c", 1, 0, 0));
        Token b = new Token("b", new SourceLocation("f.c", 1, 9, 9));
        Token c = new Token("c", new SourceLocation("f.c", 1, 4, 4));
        Token expanded = Tokens.makeExpanded(b);
        Token nowhere = new Token("?", SourceLocation.none());

        TokenRange range = TokenRange.of(List.of(c, expanded, b, nowhere, a)).orElseThrow();

        assertThat(range.first()).isSameAs(a);
        assertThat(range.last()).isSameAs(b);
    }

    @Test
    void range_ofOnlySynthesizedTokens_isEmpty() {
        Token expanded = Tokens.makeExpanded(new Token("M", AT_10));

        assertThat(TokenRange.of(List.of(expanded))).isEmpty();
    }
}
