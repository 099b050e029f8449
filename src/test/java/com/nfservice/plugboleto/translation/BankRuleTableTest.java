package com.nfservice.plugboleto.translation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("BankRuleTable")
class BankRuleTableTest {

  @Test
  @DisplayName("Should cover the ten supported banks")
  void shouldCoverTenBanks() {
    assertEquals(Set.of("237", "341", "001", "033", "748", "756", "104", "422", "021", "089"),
        BankRuleTable.supportedBanks());
  }

  @Test
  @DisplayName("Should define both layouts for every bank except 089")
  void shouldDefineBothLayouts() {
    for (String bank : BankRuleTable.supportedBanks()) {
      assertTrue(!BankRuleTable.entries(bank, LayoutVersion.CNAB_400).isEmpty(), bank);
      assertEquals(!"089".equals(bank),
          !BankRuleTable.entries(bank, LayoutVersion.CNAB_240).isEmpty(), bank);
    }
  }

  @Test
  @DisplayName("Should resolve Caixa CNAB 400 codes, which differ from the other banks")
  void shouldResolveCaixaSpecificCodes() {
    assertSame(ActionGenerators.CONFIRMED,
        BankRuleTable.lookup("104", LayoutVersion.CNAB_400, "01").orElseThrow());
    assertSame(ActionGenerators.PAYED_REFERENCE,
        BankRuleTable.lookup("104", LayoutVersion.CNAB_400, "02").orElseThrow());
    assertSame(ActionGenerators.CHANGE_DUE_DATE,
        BankRuleTable.lookup("104", LayoutVersion.CNAB_400, "05").orElseThrow());
    assertSame(ActionGenerators.PAYED,
        BankRuleTable.lookup("104", LayoutVersion.CNAB_400, "21").orElseThrow());
  }

  @Test
  @DisplayName("Should return empty for missing bank, layout or code")
  void shouldReturnEmpty_whenNoEntry() {
    assertTrue(BankRuleTable.lookup("999", LayoutVersion.CNAB_400, "02").isEmpty());
    assertTrue(BankRuleTable.lookup("089", LayoutVersion.CNAB_240, "02").isEmpty());
    assertTrue(BankRuleTable.lookup("237", LayoutVersion.CNAB_400, "10").isEmpty());
  }

  @Test
  @DisplayName("Should expose read-only tables")
  void shouldBeReadOnly() {
    assertThrows(UnsupportedOperationException.class,
        () -> BankRuleTable.entries("237", LayoutVersion.CNAB_400)
            .put("99", ActionGenerators.DEFAULT));
  }

  @Test
  @DisplayName("Should read any layout other than 400 as CNAB 240")
  void shouldParseLayoutCodes() {
    assertEquals(LayoutVersion.CNAB_400, LayoutVersion.fromCode("400"));
    assertEquals(LayoutVersion.CNAB_240, LayoutVersion.fromCode("240"));
    assertEquals(LayoutVersion.CNAB_240, LayoutVersion.fromCode((String) null));
  }
}
