package com.nfservice.plugboleto.translation;

import com.nfservice.plugboleto.model.Occurrence;
import com.nfservice.plugboleto.model.SubOccurrence;
import com.nfservice.plugboleto.model.Title;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

final class TitleFixtures {

  private TitleFixtures() {
  }

  static Title title(String bankCode) {
    Title title = new Title();
    title.setIntegrationId("id-1");
    title.setBankCode(bankCode);
    title.setDocumentNumber("DOC-123");
    title.setOurNumber("000987");
    title.setFaceValue(new BigDecimal("100.00"));
    title.setPaidValue(new BigDecimal("105.50"));
    title.setDiscountValue(new BigDecimal("1.25"));
    title.setRebateValue(new BigDecimal("10.00"));
    title.setDueDate(LocalDate.of(2024, 4, 30));
    title.setPaymentDate(LocalDate.of(2024, 3, 15));
    return title;
  }

  static Occurrence occurrence(String code) {
    Occurrence occurrence = new Occurrence(code, "Mensagem do banco",
        LocalDateTime.of(2024, 3, 15, 10, 30));
    occurrence.setSubOccurrences(List.of(new SubOccurrence("A1", "Motivo um")));
    return occurrence;
  }
}
