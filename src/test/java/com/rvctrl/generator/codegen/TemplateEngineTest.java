package com.rvctrl.generator.codegen;

import com.rvctrl.generator.model.ArtifactKind;
import com.rvctrl.generator.model.ControlSignal;
import com.rvctrl.generator.model.EncodingType;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for TemplateEngine.
 */
class TemplateEngineTest {

    private static final Clock CLOCK = Clock.fixed(
            LocalDateTime.of(2024, 3, 5, 14, 7, 9).toInstant(ZoneOffset.UTC), ZoneOffset.UTC);

    @Test
    void testSubstituteIsSinglePass() {
        String result = TemplateEngine.substitute("{a}-{b}", Map.of("a", "{b}", "b", "B"));

        assertThat(result).isEqualTo("{b}-B");
    }

    @Test
    void testUnknownPlaceholdersAreLeftUntouched() {
        String result = TemplateEngine.substitute("{a} {unknown} ${x} {", Map.of("a", "A"));

        assertThat(result).isEqualTo("A {unknown} ${x} {");
    }

    @Test
    void testReplacementWithRegexCharacters() {
        assertThat(TemplateEngine.substitute("{a}", Map.of("a", "$1 \\ {}"))).isEqualTo("$1 \\ {}");
    }

    @Test
    void testTemplateWithoutPlaceholdersIsUnchanged() {
        String template = "object Fixed {\n  val X = Value\n}\n";
        GeneratorConfig config = GeneratorConfig.builder()
                .ctrlTemplate(template)
                .autoFormat(false)
                .clock(CLOCK)
                .build();

        String rendered = new TemplateEngine(config).render(ArtifactKind.CTRL, signal(Map.of("A", List.of("add"))));

        assertThat(rendered).isEqualTo(template);
    }

    @Test
    void testMethodsListWrapsFiveInstructionsPerLine() {
        ControlSignal signal = signal(Map.of("ALU", List.of("add", "sub", "and", "or", "xor", "sll", "srl")));

        assertThat(TemplateEngine.methodsList(signal)).isEqualTo(
                "  def isALU: Seq[String] = Seq(\n"
                        + "    \"add\", \"sub\", \"and\", \"or\", \"xor\",\n"
                        + "    \"sll\", \"srl\"\n"
                        + "  )\n\n");
    }

    @Test
    void testEmptyValueUsesEmptySeq() {
        assertThat(TemplateEngine.methodsList(signal(Map.of("NOP", List.of()))))
                .isEqualTo("  def isNOP: Seq[String] = Seq.empty[String]\n\n");
    }

    @Test
    void testValueMappingsHaveNoTrailingComma() {
        Map<String, List<String>> values = new LinkedHashMap<>();
        values.put("ALU", List.of("add"));
        values.put("MEM", List.of("lw"));

        assertThat(TemplateEngine.valueMappings(signal(values))).isEqualTo(
                "    InstTypeCtrl.isALU -> InstTypeCtrl.Values(InstTypeCtrl.ALU),\n"
                        + "    InstTypeCtrl.isMEM -> InstTypeCtrl.Values(InstTypeCtrl.MEM)");
    }

    @Test
    void testValueMappingsOnlyInFieldTemplate() {
        GeneratorConfig config = GeneratorConfig.builder()
                .ctrlTemplate("{signal_name} {value_mappings}")
                .fieldTemplate("{signal_name} {value_mappings}")
                .autoFormat(false)
                .clock(CLOCK)
                .build();
        TemplateEngine engine = new TemplateEngine(config);
        ControlSignal signal = signal(Map.of("A", List.of("add")));

        assertThat(engine.render(ArtifactKind.CTRL, signal)).isEqualTo("InstTypeCtrl {value_mappings}");
        assertThat(engine.render(ArtifactKind.FIELD, signal))
                .isEqualTo("InstTypeCtrl     InstTypeCtrl.isA -> InstTypeCtrl.Values(InstTypeCtrl.A)");
    }

    @Test
    void testScalarPlaceholders() {
        GeneratorConfig config = GeneratorConfig.builder()
                .ctrlTemplate("{signal_name}|{encoding_type}|{signal_width}|{generation_time}")
                .clock(CLOCK)
                .build();

        String rendered = new TemplateEngine(config).render(ArtifactKind.CTRL, signal(Map.of("A", List.of())));

        assertThat(rendered).isEqualTo("InstTypeCtrl|OneHot|1|2024-03-05 14:07:09");
    }

    @Test
    void testBuiltInTemplates() {
        TemplateEngine engine = new TemplateEngine(GeneratorConfig.builder().clock(CLOCK).build());
        Map<String, List<String>> values = new LinkedHashMap<>();
        values.put("ALU", List.of("add", "sub"));
        values.put("MEM", List.of("lw"));

        Map<ArtifactKind, String> rendered = engine.renderAll(signal(values));

        assertThat(rendered.get(ArtifactKind.CTRL))
                .contains("object InstTypeCtrl extends CtrlEnum(CtrlEnum.OneHot) {")
                .contains("    val ALU = Value")
                .contains("    def isMEM: Seq[String] = Seq(")
                .doesNotContain("{values_list}");
        assertThat(rendered.get(ArtifactKind.FIELD))
                .contains("object InstTypeCtrlField extends DecodeField[InstructionPattern, UInt] {")
                .contains("InstTypeCtrl.isMEM -> InstTypeCtrl.Values(InstTypeCtrl.MEM)")
                .contains("import rv.util.decoder.ctrl.InstTypeCtrl");
    }

    @Test
    void testExampleTemplateIsBundled() {
        assertThat(TemplateEngine.loadBuiltInTemplate(TemplateEngine.EXAMPLE_CTRL_TEMPLATE_RESOURCE))
                .contains("{methods_list}");
    }

    private static ControlSignal signal(Map<String, List<String>> values) {
        return ControlSignal.builder()
                .name("InstTypeCtrl")
                .encodingType(EncodingType.ONE_HOT)
                .width(values.size())
                .values(values)
                .instructions(values.values().stream().flatMap(List::stream).distinct().toList())
                .createdAt("2024-03-05 14:07:09")
                .signalId("20240305_140709_000000")
                .build();
    }
}
