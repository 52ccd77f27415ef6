/* (C)2026 */
package com.ammann.updatetracker.properties;

import static org.assertj.core.api.Assertions.assertThat;

import java.lang.reflect.Constructor;
import java.lang.reflect.Modifier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ApiProperties")
class ApiPropertiesTest {

    @Test
    @DisplayName("should construct full container path")
    void shouldConstructFullContainerPath() {
        assertThat(ApiProperties.BASE_URL_V1 + ApiProperties.Container.BASE)
                .isEqualTo("/api/v1/containers");
    }

    @Test
    @DisplayName("should construct full batch runs path")
    void shouldConstructFullBatchRunsPath() {
        assertThat(ApiProperties.BASE_URL_V1 + ApiProperties.Batch.BASE + ApiProperties.Batch.RUNS)
                .isEqualTo("/api/v1/batch/runs");
    }

    @Test
    @DisplayName("should have private constructors")
    void shouldHavePrivateConstructors() throws Exception {
        for (Class<?> type :
                new Class<?>[] {
                    ApiProperties.class, ApiProperties.Container.class, ApiProperties.Batch.class
                }) {
            Constructor<?> constructor = type.getDeclaredConstructor();
            assertThat(Modifier.isPrivate(constructor.getModifiers())).isTrue();
        }
    }
}
