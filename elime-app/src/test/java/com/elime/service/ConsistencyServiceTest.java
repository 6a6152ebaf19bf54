package com.elime.service;

import com.elime.model.PhotoRecord;
import com.elime.repository.EyePositionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ConsistencyServiceTest {

    private EyePositionRepository repository;
    private ConsistencyService service;

    @BeforeEach
    void setUp() {
        repository = mock(EyePositionRepository.class);
        service = new ConsistencyService(repository);
    }

    private static PhotoRecord record(String name) {
        return new PhotoRecord(name, LocalDateTime.of(2024, 1, 1, 0, 0), null, null);
    }

    @Nested
    @DisplayName("findSingle")
    class FindSingle {

        @Test
        void returnsEmptyForUnknownPhoto() {
            assertThat(service.findSingle("x.jpg")).isEmpty();
        }

        @Test
        void returnsTheOnlyRecord() {
            when(repository.findByFileName("x.jpg")).thenReturn(List.of(record("x.jpg")));

            assertThat(service.findSingle("x.jpg")).contains(record("x.jpg"));
        }

        @Test
        void treatsTwoRowsAsCorruption() {
            when(repository.findByFileName("x.jpg")).thenReturn(List.of(record("x.jpg"), record("x.jpg")));

            assertThatThrownBy(() -> service.findSingle("x.jpg"))
                .isInstanceOfSatisfying(StoreCorruptionException.class, e -> {
                    assertThat(e.getFileName()).isEqualTo("x.jpg");
                    assertThat(e.getOccurrences()).isEqualTo(2);
                })
                .hasMessage("Database in bad shape. Found 2 occurrences of photo named x.jpg");
        }
    }

    @Nested
    @DisplayName("folderCoversStore")
    class FolderCoversStore {

        @Test
        void acceptsEqualOrLargerFolder() {
            when(repository.count()).thenReturn(3);

            assertThat(service.folderCoversStore(3)).isTrue();
            assertThat(service.folderCoversStore(4)).isTrue();
        }

        @Test
        void rejectsShrunkenFolder() {
            when(repository.count()).thenReturn(3);

            assertThat(service.folderCoversStore(2)).isFalse();
        }
    }

    @Test
    void orphansAreStoredNamesMissingFromFolder() {
        when(repository.findAllOrderByCaptureDate()).thenReturn(List.of(record("a.jpg"), record("b.jpg")));

        assertThat(service.orphans(List.of("a.jpg"))).containsExactly("b.jpg");
        assertThat(service.orphans(List.of("a.jpg", "b.jpg", "c.jpg"))).isEmpty();
    }
}
