package com.starscape.phototriage.features.catalog.app;

import com.starscape.phototriage.features.catalog.api.dto.HashImportItem;
import com.starscape.phototriage.features.catalog.api.dto.ImportHashesRequest;
import com.starscape.phototriage.features.catalog.api.dto.ImportHashesResponse;
import com.starscape.phototriage.features.catalog.domain.Photo;
import com.starscape.phototriage.features.catalog.domain.PhotoRepository;
import com.starscape.phototriage.support.TestPhotos;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ImportPriorHashesHandlerTest {
    
    @Mock
    private PhotoRepository photoRepository;
    
    @InjectMocks
    private ImportPriorHashesHandler handler;
    
    @Test
    @DisplayName("fills empty hashes, leaves existing ones and counts unknown photos")
    void importsHashes() {
        Photo fresh = TestPhotos.photo("aa", 100, 100, 10L);
        Photo hashed = TestPhotos.photo("bb", 100, 100, 10L);
        hashed.assignHashes("0000000000000001", "0000000000000002");
        when(photoRepository.findAllById(any())).thenReturn(List.of(fresh, hashed));
        
        ImportHashesResponse response = handler.handle(new ImportHashesRequest(List.of(
            new HashImportItem("AA", "00000000000000FF", null),
            new HashImportItem("bb", "ffffffffffffffff", "ffffffffffffffff"),
            new HashImportItem("cc", "0000000000000000", null))));
        
        assertThat(response.imported()).isEqualTo(1);
        assertThat(response.alreadyHashed()).isEqualTo(1);
        assertThat(response.unknownPhotos()).isEqualTo(1);
        assertThat(fresh.getPrimaryHash()).isEqualTo("00000000000000ff");
        assertThat(fresh.hasSecondaryHash()).isFalse();
        assertThat(hashed.getPrimaryHash()).isEqualTo("0000000000000001");
        verify(photoRepository).saveAll(List.of(fresh));
    }
    
    @Test
    @DisplayName("malformed hex fails the whole import")
    void rejectsMalformedHex() {
        when(photoRepository.findAllById(any())).thenReturn(List.of(TestPhotos.photo("aa", 100, 100, 10L)));
        
        assertThatThrownBy(() -> handler.handle(new ImportHashesRequest(List.of(
                new HashImportItem("aa", "not-hex-at-all!!", null)))))
            .isInstanceOf(IllegalArgumentException.class);
        verify(photoRepository, never()).saveAll(any());
    }
}
