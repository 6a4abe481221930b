package com.usedmarket.procurement.client;

public enum ChargeResult {
  OK,
  INSUFFICIENT_FUNDS
}
