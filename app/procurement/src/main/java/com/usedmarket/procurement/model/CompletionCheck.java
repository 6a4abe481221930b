package com.usedmarket.procurement.model;

public enum CompletionCheck {
  NONE,
  SUCCESS,
  FAILED
}
