package org.xgen.generators.dispatch;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.xgen.core.model.SimpleType;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

public class GenerationDispatcherTest {

  private GenerationDispatcher dispatcher;
  private RecordingRenderer renderer;

  static class RecordingRenderer {
    final List<String> calls = new ArrayList<>();

    @GenerationHook("GoSimpleType")
    public void simpleType(SimpleType simpleType) {
      calls.add("simple:" + simpleType.name());
    }

    @GenerationHook
    public void pair(String left, Integer right) {
      calls.add("pair:" + left + right);
    }

    @GenerationHook("GoFails")
    public void fails(Object node) throws GenerationException {
      throw new GenerationException("cannot render " + node);
    }

    @GenerationHook("GoCrashes")
    public void crashes(Object node) {
      throw new IllegalStateException("crashed on " + node);
    }

    public void notAHook(Object node) {
      calls.add("notAHook");
    }
  }

  @BeforeEach
  void setUp() {
    dispatcher = new GenerationDispatcher();
    renderer = new RecordingRenderer();
    dispatcher.registerAll(renderer);
  }

  @Test
  void shouldRegisterAnnotatedMethodsOnly() {
    assertThat(dispatcher.hookNames()).containsExactlyInAnyOrder("GoSimpleType", "pair", "GoFails", "GoCrashes");
    assertThat(dispatcher.hasHook("notAHook")).isFalse();
  }

  @Test
  void shouldInvokeHookByName() throws GenerationException {
    dispatcher.dispatch("GoSimpleType", SimpleType.alias("Max35Text", "xs:string"));
    dispatcher.dispatch("pair", "a", 1);

    assertThat(renderer.calls).containsExactly("simple:Max35Text", "pair:a1");
  }

  @Test
  void missingHookIsSilentlySkipped() {
    assertThatCode(() -> dispatcher.dispatch("GoComplexType", SimpleType.alias("X", "xs:string")))
        .doesNotThrowAnyException();
    assertThatCode(() -> dispatcher.dispatch("notAHook", "x")).doesNotThrowAnyException();
    assertThat(renderer.calls).isEmpty();
  }

  @Test
  void shouldPropagateHookFailureUnchanged() {
    assertThatThrownBy(() -> dispatcher.dispatch("GoFails", "Currency"))
        .isExactlyInstanceOf(GenerationException.class)
        .hasMessage("cannot render Currency")
        .hasNoCause();
  }

  @Test
  void shouldWrapUnexpectedHookExceptions() {
    assertThatThrownBy(() -> dispatcher.dispatch("GoCrashes", "Currency"))
        .isInstanceOf(GenerationException.class)
        .hasMessageContaining("GoCrashes")
        .hasCauseInstanceOf(IllegalStateException.class);
  }

  @Test
  void shouldReportArgumentMismatchAsFailure() {
    assertThatThrownBy(() -> dispatcher.dispatch("GoSimpleType", "not a node"))
        .isInstanceOf(GenerationException.class)
        .hasMessageContaining("GoSimpleType");
  }

  @Test
  void shouldAcceptFunctionalHandlers() throws GenerationException {
    List<Object> seen = new ArrayList<>();
    dispatcher.register("TypeScriptElement", args -> seen.add(args[0]));

    dispatcher.dispatch("TypeScriptElement", "Document");

    assertThat(seen).containsExactly("Document");
  }

  @Test
  void shouldRejectDuplicateHookNames() {
    assertThatThrownBy(() -> dispatcher.register("GoSimpleType", args -> { }))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("GoSimpleType");
    assertThatThrownBy(() -> dispatcher.registerAll(new RecordingRenderer()))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void shouldRejectBlankHookNames() {
    assertThatThrownBy(() -> dispatcher.register("", args -> { }))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
