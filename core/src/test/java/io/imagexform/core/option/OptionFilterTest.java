package io.imagexform.core.option;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class OptionFilterTest {

    @Test
    void selectKeepsAcceptedKeysInOrder() {
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("strip", true);
        options.put("bogus", 1);
        options.put("quality", 80);

        Map<String, Object> selected = OptionFilter.select(options, Set.of("quality", "strip"));

        assertThat(selected).containsExactly(Map.entry("strip", true), Map.entry("quality", 80));
        assertThat(OptionFilter.rejected(options, Set.of("quality", "strip"))).containsExactly("bogus");
    }

    @Test
    void selectOnEmptyOptions() {
        assertThat(OptionFilter.select(Map.of(), Set.of("quality"))).isEmpty();
    }

    @Test
    void flattenNestedGroups() {
        Map<String, Object> group = new LinkedHashMap<>();
        group.put("png", Map.of("compression_level", 8));
        group.put("jpeg", Map.of("fancy_upsampling", "off"));

        assertThat(OptionFilter.flatten(group, '-'))
                .containsExactly("png:compression-level=8", "jpeg:fancy-upsampling=off");
    }

    @Test
    void flattenTopLevelAtom() {
        assertThat(OptionFilter.flatten(Map.of("area", "1GB"), '-')).containsExactly("area=1GB");
    }

    @Test
    void flattenGroupsReplacesUnacceptedGroupsWithAtoms() {
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("quality", 80);
        options.put("jpeg", Map.of("fancy_upsampling", "off"));
        options.put("define", Map.of("png", Map.of("compression_level", 8)));

        Map<String, Object> flattened = OptionFilter.flattenGroups(options, Set.of("quality", "define"), '-');

        assertThat(flattened)
                .containsExactly(
                        Map.entry("quality", 80),
                        Map.entry("jpeg:fancy-upsampling", "off"),
                        Map.entry("define", Map.of("png", Map.of("compression_level", 8))));
    }

    @Test
    void namespacedAtomsMatchNamespaceEntries() {
        Map<String, Object> atoms = new LinkedHashMap<>();
        atoms.put("jpeg:size", "100x100");
        atoms.put("png:bit-depth", 8);
        atoms.put("tiff:endian", "lsb");

        assertThat(OptionFilter.select(atoms, Set.of("jpeg:size", "png:*")))
                .containsOnlyKeys("jpeg:size", "png:bit-depth");
        assertThat(OptionFilter.select(atoms, Set.of(OptionFilter.ANY_NAMESPACE))).hasSize(3);
        assertThat(OptionFilter.rejected(atoms, Set.of("png:*"))).containsExactly("jpeg:size", "tiff:endian");
    }

    @Test
    void plainKeysNeverMatchNamespaceWildcard() {
        assertThat(OptionFilter.select(Map.of("quality", 80), Set.of(OptionFilter.ANY_NAMESPACE))).isEmpty();
    }
}
