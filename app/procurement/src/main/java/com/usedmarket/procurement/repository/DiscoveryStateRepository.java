package com.usedmarket.procurement.repository;

import com.usedmarket.procurement.model.DiscoveryStateSnapshot;
import java.util.List;

public interface DiscoveryStateRepository {

  void save(DiscoveryStateSnapshot snapshot);

  /** 破損レコードは読み飛ばす。 */
  List<DiscoveryStateSnapshot> loadAll();
}
