package com.hartwig.hpcwe.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.hartwig.hpcwe.model.FileReference;
import com.hartwig.hpcwe.model.StoreParameter;

import org.junit.jupiter.api.Test;

class ParameterCodecTest {
    private final ParameterCodec codec = new ParameterCodec(WorkflowStores.objectMapper());

    @Test
    void unsetParameterIsEncodedAsZero() {
        var parameter = StoreParameter.builder().id(0).isSet(false).build();
        var encoded = codec.encode(parameter);

        assertThat(encoded.asInt()).isZero();
        assertThat(codec.decode(0, encoded, Map.of()).isSet()).isFalse();
    }

    @Test
    void setsAndTuplesAreRestoredFromTypeLookup() {
        var value = new LinkedHashMap<String, Object>();
        value.put("tags", new LinkedHashSet<>(List.of("a", "b")));
        value.put("shape", new Object[] { 2, 3 });
        value.put("plain", List.of(1, 2));
        var parameter = StoreParameter.builder().id(4).isSet(true).data(value).build();

        var encoded = codec.encode(parameter);
        assertThat(encoded.get("type_lookup").get("sets").toString()).isEqualTo("[[\"tags\"]]");
        assertThat(encoded.get("type_lookup").get("tuples").toString()).isEqualTo("[[\"shape\"]]");

        var decoded = (Map<?, ?>) codec.decode(4, encoded, Map.of()).data().orElseThrow();
        assertThat(decoded.get("tags")).isInstanceOf(Set.class).isEqualTo(Set.of("a", "b"));
        assertThat(decoded.get("shape")).isInstanceOf(Object[].class);
        assertThat((Object[]) decoded.get("shape")).containsExactly(2, 3);
        assertThat(decoded.get("plain")).isEqualTo(List.of(1, 2));
    }

    @Test
    void nestedContainersAreRestored() {
        var inner = new LinkedHashSet<Object>(List.of(1));
        var outer = new ArrayList<Object>();
        outer.add(new Object[] { inner, 2 });
        var parameter = StoreParameter.builder().id(1).isSet(true).data(outer).build();

        var decoded = (List<?>) codec.decode(1, codec.encode(parameter), Map.of()).data().orElseThrow();
        var tuple = (Object[]) decoded.get(0);
        assertThat(tuple[0]).isEqualTo(Set.of(1));
        assertThat(tuple[1]).isEqualTo(2);
    }

    @Test
    void fileParametersKeepTheirReference() {
        var reference = FileReference.builder().storeContents(true).path("artifacts/input_files/0/in.txt").build();
        var parameter = StoreParameter.builder().id(2).isSet(true).file(reference).build();

        var decoded = codec.decode(2, codec.encode(parameter), Map.of("type", "local_input"));
        assertThat(decoded.file()).contains(reference);
        assertThat(decoded.source()).isEqualTo(Map.of("type", "local_input"));
    }

    @Test
    void tooDeeplyNestedDataIsRejected() {
        Object value = 1;
        for (int i = 0; i <= ParameterCodec.MAX_DEPTH + 1; i++) {
            var wrapper = new ArrayList<Object>();
            wrapper.add(value);
            value = wrapper;
        }
        var parameter = StoreParameter.builder().id(0).isSet(true).data(value).build();
        assertThrows(IllegalArgumentException.class, () -> codec.encode(parameter));
    }
}
