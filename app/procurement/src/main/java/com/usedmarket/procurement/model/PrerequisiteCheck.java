package com.usedmarket.procurement.model;

/** detail は不足している条件の現在値/要求値 ("2/3" など)。該当しない場合は空文字。 */
public record PrerequisiteCheck(boolean eligible, PrerequisiteReason reason, String detail) {

  public static PrerequisiteCheck failed(PrerequisiteReason reason, String detail) {
    return new PrerequisiteCheck(false, reason, detail);
  }

  public static PrerequisiteCheck eligibleCheck() {
    return new PrerequisiteCheck(true, PrerequisiteReason.ELIGIBLE, "");
  }
}
