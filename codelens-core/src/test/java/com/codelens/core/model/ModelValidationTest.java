package com.codelens.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the validation and helpers of the model records.
 */
class ModelValidationTest {

    @Test
    void location_endBeforeStart_throws() {
        assertThatThrownBy(() -> new Location("a.py", 5, 4, 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("lineEnd");
    }

    @Test
    void location_zeroLine_throws() {
        assertThatThrownBy(() -> Location.at("a.py", 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void relationship_emptyTarget_throws() {
        assertThatThrownBy(() -> Relationship.of("a", "", RelationshipKind.CALLS, null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void functionEntity_classKind_throws() {
        assertThatThrownBy(() -> new FunctionEntity("f", EntityKind.CLASS, Location.at("a.py", 1), null, null, null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void classBuilder_build_freezesMethodsAndCountsThem() {
        Location location = new Location("a.py", 1, 4, 0);
        FunctionEntity method = new FunctionEntity("run", EntityKind.FUNCTION, location, null, null, Map.of());
        ClassEntity.Builder builder = ClassEntity.builder("Job", location).baseClasses(List.of("Base")).addMethod(method);

        ClassEntity built = builder.build();
        builder.addMethod(method);

        assertThat(built.methods()).hasSize(1);
        assertThat(built.metadata()).containsEntry("method_count", 1);
        assertThat(builder.build().methods()).hasSize(2);
    }

    @Test
    void fileAnalysis_variantAccessors_filterByKind() {
        Location location = new Location("jobs/run.py", 1, 2, 0);
        FunctionEntity function = new FunctionEntity("run", EntityKind.FUNCTION, location, null, null, Map.of());
        ClassEntity cls = ClassEntity.builder("Job", location).build();
        ImportEntity imported = ImportEntity.of("os", Location.at("jobs/run.py", 1), "os", null, false);

        FileAnalysis analysis = new FileAnalysis("jobs/run.py", List.of(imported, function, cls), List.of(), List.of(), null)
            .withMetadata(FileAnalysis.IS_TEST_FILE, true);

        assertThat(analysis.functions()).containsExactly(function);
        assertThat(analysis.classes()).containsExactly(cls);
        assertThat(analysis.imports()).containsExactly(imported);
        assertThat(analysis.fileName()).isEqualTo("run.py");
        assertThat(analysis.testFile()).isTrue();
        assertThat(analysis.partial()).isFalse();
    }

    @Test
    void entityKind_fromValue_roundTripsSerializedName() {
        for (EntityKind kind : EntityKind.values()) {
            assertThat(EntityKind.fromValue(kind.value())).isEqualTo(kind);
        }
        assertThatThrownBy(() -> EntityKind.fromValue("module")).isInstanceOf(IllegalArgumentException.class);
    }
}
