package com.codeheadsystems.cipherscore.server.model;

import com.codeheadsystems.cipherscore.codec.OpaqueValue;

/**
 * The encrypted inputs of one data submission. Replaced wholesale on every submission.
 *
 * @param income            encrypted income
 * @param assets            encrypted assets
 * @param debts             encrypted debts
 * @param paymentHistory    encrypted payment-history score
 * @param creditUtilization encrypted credit-utilization ratio (percent)
 */
public record FinancialAttributes(
    OpaqueValue income,
    OpaqueValue assets,
    OpaqueValue debts,
    OpaqueValue paymentHistory,
    OpaqueValue creditUtilization) {

  public FinancialAttributes {
    requirePresent(income, "income");
    requirePresent(assets, "assets");
    requirePresent(debts, "debts");
    requirePresent(paymentHistory, "paymentHistory");
    requirePresent(creditUtilization, "creditUtilization");
  }

  private static void requirePresent(OpaqueValue value, String field) {
    if (value == null) {
      throw new IllegalArgumentException("Missing required field: " + field);
    }
  }
}
