package com.parkthrive.crmops.resolve;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.parkthrive.crmops.crm.CrmAddress;
import com.parkthrive.crmops.crm.CrmClient;
import com.parkthrive.crmops.crm.CrmRecord;
import com.parkthrive.crmops.crm.DetailResult;
import com.parkthrive.crmops.crm.SearchResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CrossAccountLookupTest {

    @Mock
    private CrmClient secondary;

    private CrossAccountLookup lookup;

    @BeforeEach
    void setUp() {
        lookup = new CrossAccountLookup(secondary, new ObjectMapper());
    }

    @Test
    void testFindAddress_PrefersBusinessAddressOfFirstHit() {
        when(secondary.search(any())).thenReturn(SearchResult.builder()
                .status(SearchResult.Status.OK)
                .item(CrmRecord.builder().id("pt_1").build())
                .item(CrmRecord.builder().id("pt_2").build())
                .build());
        when(secondary.getLead("pt_1")).thenReturn(DetailResult.found(200, CrmRecord.builder()
                .id("pt_1")
                .address(CrmAddress.builder().label("mailing").address1("1 Other Rd").city("Waco").build())
                .address(CrmAddress.builder().label("business").address1("500 Lot Ave").address2("Suite 2")
                        .city("Austin").state("TX").zipcode("78701").build())
                .build()));

        Optional<String> address = lookup.findAddress("cf_pt_uid", "LOT-77");

        assertThat(address).contains("500 Lot Ave Suite 2 Austin, TX, 78701");
        verify(secondary, never()).getLead("pt_2");
    }

    @Test
    void testFindAddress_SendsPrefixSearchOnField() {
        when(secondary.search(any())).thenReturn(SearchResult.builder().status(SearchResult.Status.OK).build());

        assertThat(lookup.findAddress("cf_pt_uid", "LOT-77")).isEmpty();

        ArgumentCaptor<ObjectNode> query = ArgumentCaptor.forClass(ObjectNode.class);
        verify(secondary).search(query.capture());
        String json = query.getValue().toString();
        assertThat(query.getValue().get("limit").asInt()).isEqualTo(10);
        assertThat(json).contains("\"custom_field_id\":\"cf_pt_uid\"", "\"value\":\"LOT-77\"", "beginning_of_words");
    }

    @Test
    void testFindAddress_FailedSearchIsNoData() {
        when(secondary.search(any())).thenReturn(SearchResult.failed(500, "boom"));

        assertThat(lookup.findAddress("cf_pt_uid", "LOT-77")).isEmpty();
    }

    @Test
    void testFindAddress_BlankValueSkipsSearch() {
        assertThat(lookup.findAddress("cf_pt_uid", " ")).isEmpty();
        verify(secondary, never()).search(any());
    }

    @Test
    void testPickAddress_FallsBackToFirst() {
        CrmAddress first = CrmAddress.builder().label("mailing").address1("1 A St").build();
        CrmAddress second = CrmAddress.builder().label("other").address1("2 B St").build();

        assertThat(CrossAccountLookup.pickAddress(List.of(first, second))).containsSame(first);
        assertThat(CrossAccountLookup.pickAddress(List.of())).isEmpty();
    }
}
