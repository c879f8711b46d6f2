package me.christianrobert.pyibackport.transformer.rest;

import me.christianrobert.pyibackport.config.service.ConfigService;
import me.christianrobert.pyibackport.transformer.context.TransformationResult;
import me.christianrobert.pyibackport.transformer.parser.AntlrParser;
import me.christianrobert.pyibackport.transformer.service.StubTransformationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the backport REST endpoint, called directly without an HTTP layer.
 */
class StubTransformationResourceTest {

    private StubTransformationResource resource;
    private ConfigService configService;

    @BeforeEach
    void setUp() {
        configService = new ConfigService();
        resource = new StubTransformationResource();
        resource.transformationService = new StubTransformationService(new AntlrParser());
        resource.configService = configService;
    }

    @Test
    void usesConfiguredDefaultTarget() {
        TransformationResult result = resource.backportStub(null, null, "type X = int\n");

        assertTrue(result.isSuccess());
        assertEquals("3.10", result.getTargetVersion());
        assertEquals("from typing import TypeAlias\nX: TypeAlias = int\n", result.getTransformedSource());
    }

    @Test
    void explicitTargetWins() {
        configService.setConfigValue(ConfigService.DEFAULT_TARGET, "3.10");

        TransformationResult result = resource.backportStub("3.12", false, "type X = int\n");

        assertTrue(result.isSuccess());
        assertEquals("type X = int\n", result.getTransformedSource());
    }

    @Test
    void blankTargetFallsBackToConfiguration() {
        configService.setConfigValue(ConfigService.DEFAULT_TARGET, "3.12");

        TransformationResult result = resource.backportStub("  ", false, "class C[T]: ...\n");

        assertEquals("3.12", result.getTargetVersion());
        assertEquals("class C[T]: ...\n", result.getTransformedSource());
    }

    @Test
    void astFlagFallsBackToConfiguration() {
        configService.setConfigValue(ConfigService.INCLUDE_AST, true);

        assertTrue(resource.backportStub("3.10", null, "x: int\n").hasAstTree());
        assertFalse(resource.backportStub("3.10", false, "x: int\n").hasAstTree());
    }

    @Test
    void wildcardDenylistComesFromConfiguration() {
        configService.setConfigValue(ConfigService.WILDCARD_DENYLIST, "os");

        TransformationResult result = resource.backportStub("3.10", false, "from os import *\n");

        assertTrue(result.isFailure());
        assertEquals("UnsupportedConstruct", result.getErrorKind());
    }

    @Test
    void rejectedStubIsAFailedResult() {
        TransformationResult result = resource.backportStub("3.10", false, "class O(object): ...\n");

        assertFalse(result.isSuccess());
        assertEquals("UnsupportedConstruct", result.getErrorKind());
        assertTrue(result.getErrorMessage().contains("'builtins.object' cannot be subclassed"));
    }

    @Test
    void invalidTargetIsAFailedResult() {
        TransformationResult result = resource.backportStub("2.7", false, "x: int\n");

        assertTrue(result.isFailure());
        assertTrue(result.getErrorMessage().contains("2.7"));
    }

    @Test
    void nullBodyIsAFailedResult() {
        TransformationResult result = resource.backportStub("3.10", false, null);

        assertTrue(result.isFailure());
        assertEquals("Stub source cannot be null", result.getErrorMessage());
    }
}
