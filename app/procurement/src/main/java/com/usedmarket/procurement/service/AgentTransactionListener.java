package com.usedmarket.procurement.service;

import com.usedmarket.procurement.model.SimulationTime;

/**
 * 役割: 出品購入の完了を受け取る。
 * 動作: SearchScheduler が購入確定後に同期的に呼び出す。
 * 前提: 実装は例外を送出しないこと。送出された場合は呼び出し側でログに記録される。
 */
public interface AgentTransactionListener {

  void onAgentPurchase(String consumerId, String tierId, SimulationTime now);
}
