package me.christianrobert.kugelblitz.translator.service;

import me.christianrobert.kugelblitz.config.service.ConfigService;
import me.christianrobert.kugelblitz.translator.ast.Assign;
import me.christianrobert.kugelblitz.translator.ast.BinOp;
import me.christianrobert.kugelblitz.translator.ast.BinaryOperator;
import me.christianrobert.kugelblitz.translator.ast.Module;
import me.christianrobert.kugelblitz.translator.ast.Name;
import me.christianrobert.kugelblitz.translator.ast.Num;
import me.christianrobert.kugelblitz.translator.ast.SyntaxNode;
import me.christianrobert.kugelblitz.translator.ast.Tuple;
import me.christianrobert.kugelblitz.translator.context.TranslationOptions;
import me.christianrobert.kugelblitz.translator.context.TranslationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for TranslationService with a mocked configuration.
 */
class TranslationServiceTest {

    private TranslationService translationService;
    private ConfigService configService;

    @BeforeEach
    void setUp() {
        configService = mock(ConfigService.class);

        // Manually create service and inject dependencies
        translationService = new TranslationService();
        translationService.configService = configService;
    }

    private static Module tupleValueProgram() {
        return new Module(Collections.singletonList(
            new Assign(new Name("pair"), new Tuple(Arrays.asList(new Num("1"), new Num("2"))))));
    }

    @Test
    void optionsAreReadFromConfiguration() {
        when(configService.getConfigValueAsBoolean(eq(ConfigService.STRICT_TUPLES), anyBoolean())).thenReturn(true);
        when(configService.getConfigValueAsBoolean(eq(ConfigService.STRICT_CLASS_MEMBERS), anyBoolean())).thenReturn(true);

        TranslationOptions options = translationService.currentOptions();

        assertTrue(options.isStrictTuples());
        assertFalse(options.isStrictFloorDivision());
        assertTrue(options.isStrictClassMembers());
    }

    @Test
    void lenientConfigurationKeepsPlaceholder() {
        TranslationResult result = translationService.translate(tupleValueProgram());

        assertTrue(result.isSuccess());
        assertEquals("pair = ?tuple?;", result.getJavaScript());
    }

    @Test
    void strictTuplesTurnPlaceholderIntoFailure() {
        when(configService.getConfigValueAsBoolean(eq(ConfigService.STRICT_TUPLES), anyBoolean())).thenReturn(true);

        TranslationResult result = translationService.translate(tupleValueProgram());

        assertTrue(result.isFailure());
        assertNull(result.getJavaScript());
        assertEquals("SemanticException", result.getErrorType());
    }

    @Test
    void strictFloorDivisionTurnsIntoFailure() {
        when(configService.getConfigValueAsBoolean(eq(ConfigService.STRICT_FLOOR_DIVISION), anyBoolean())).thenReturn(true);
        SyntaxNode tree = new BinOp(new Name("a"), BinaryOperator.FLOOR_DIV, new Name("b"));

        TranslationResult result = translationService.translate(tree);

        assertTrue(result.isFailure());
        assertTrue(result.getErrorMessage().contains("Floor division"));
    }

    @Test
    void includeTreeSettingAttachesTree() {
        when(configService.getConfigValueAsBoolean(eq(ConfigService.INCLUDE_TREE), anyBoolean())).thenReturn(true);

        TranslationResult result = translationService.translate(new Name("x"));

        assertTrue(result.isSuccess());
        assertEquals("NAME [x]\n", result.getSyntaxTree());
    }

    @Test
    void configurationIsReadOnEveryCall() {
        translationService.translate(new Name("x"));
        translationService.translate(new Name("y"));

        verify(configService, times(2)).getConfigValueAsBoolean(eq(ConfigService.STRICT_TUPLES), anyBoolean());
    }

    @Test
    void unexpectedErrorBecomesFailure() {
        when(configService.getConfigValueAsBoolean(eq(ConfigService.STRICT_TUPLES), anyBoolean()))
            .thenThrow(new IllegalStateException("config unavailable"));

        TranslationResult result = translationService.translate(new Name("x"), false);

        assertTrue(result.isFailure());
        assertEquals("Unexpected error: config unavailable", result.getErrorMessage());
    }
}
