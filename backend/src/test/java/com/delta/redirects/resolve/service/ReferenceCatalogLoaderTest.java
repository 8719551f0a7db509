package com.delta.redirects.resolve.service;

import com.delta.redirects.resolve.model.UrlCategory;
import com.delta.redirects.resolve.persistence.RedirectJdbcRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReferenceCatalogLoaderTest {

    @Mock
    private RedirectJdbcRepository repository;

    @Test
    void keepsDistinctStringCodesInOrder() throws Exception {
        ReferenceCatalogLoader loader = new ReferenceCatalogLoader(new ObjectMapper(), repository);

        List<String> codes = loader.readCodes(ErrorSourceLoaderTest.fixture("products.json"));

        assertThat(codes).containsExactly("XYZ100", "ABC1");
    }

    @Test
    void storesCodesUnderTheirCategory() throws Exception {
        when(repository.insertCodes(UrlCategory.PRODUCT, List.of("XYZ100", "ABC1"))).thenReturn(1);
        ReferenceCatalogLoader loader = new ReferenceCatalogLoader(new ObjectMapper(), repository);

        int loaded = loader.load(UrlCategory.PRODUCT, ErrorSourceLoaderTest.fixture("products.json"));

        assertThat(loaded).isEqualTo(2);
        verify(repository).insertCodes(UrlCategory.PRODUCT, List.of("XYZ100", "ABC1"));
    }
}
