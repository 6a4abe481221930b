/*
 * どこで: Procurement レプリケーション
 * 何を: 検索レコードと出品を固定順序のバイト列へ直列化/復元する
 * なぜ: 権威ノード以外へ読み取り専用スナップショットを送るため
 */
package com.usedmarket.procurement.replication;

import com.google.common.io.ByteArrayDataInput;
import com.google.common.io.ByteArrayDataOutput;
import com.google.common.io.ByteStreams;
import com.usedmarket.procurement.model.FoundItem;
import com.usedmarket.procurement.model.InspectionState;
import com.usedmarket.procurement.model.ItemReference;
import com.usedmarket.procurement.model.ListingSnapshot;
import com.usedmarket.procurement.model.ListingStatus;
import com.usedmarket.procurement.model.SearchRecordSnapshot;
import com.usedmarket.procurement.model.SearchStatus;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import org.springframework.stereotype.Component;

/** 読み出し順は書き込み順と完全に一致させること。順序の検証は行わない。 */
@Component
public class SearchWireCodec {

  public byte[] encodeSearch(SearchRecordSnapshot snapshot) {
    final ByteArrayDataOutput out = ByteStreams.newDataOutput();
    out.writeUTF(snapshot.id());
    out.writeUTF(snapshot.consumerId());
    out.writeUTF(snapshot.item().catalogKey());
    out.writeUTF(nullToEmpty(snapshot.item().displayName()));
    out.writeLong(snapshot.item().basePrice());
    out.writeUTF(snapshot.tierId());
    out.writeUTF(snapshot.qualityId());
    writeConfigurations(out, snapshot.requestedConfigurations());
    out.writeDouble(snapshot.creditModifier());
    out.writeLong(snapshot.cost());
    out.writeInt(snapshot.ttl());
    out.writeInt(snapshot.tts());
    out.writeBoolean(snapshot.successOutcome());
    writeOptionalItem(out, snapshot.pendingFind());
    out.writeUTF(snapshot.status().value());
    writeOptionalItem(out, snapshot.foundItem());
    out.writeLong(snapshot.createdAtHour());
    return out.toByteArray();
  }

  public SearchRecordSnapshot decodeSearch(byte[] payload) {
    final ByteArrayDataInput in = ByteStreams.newDataInput(payload);
    final String id = in.readUTF();
    final String consumerId = in.readUTF();
    final ItemReference item = new ItemReference(in.readUTF(), in.readUTF(), in.readLong());
    final String tierId = in.readUTF();
    final String qualityId = in.readUTF();
    final SortedMap<String, Integer> requested = readConfigurations(in);
    final double creditModifier = in.readDouble();
    final long cost = in.readLong();
    final int ttl = in.readInt();
    final int tts = in.readInt();
    final boolean successOutcome = in.readBoolean();
    final FoundItem pendingFind = readOptionalItem(in);
    final SearchStatus status = SearchStatus.fromValue(in.readUTF());
    final FoundItem foundItem = readOptionalItem(in);
    final long createdAtHour = in.readLong();
    return new SearchRecordSnapshot(
        id,
        consumerId,
        item,
        tierId,
        qualityId,
        requested,
        creditModifier,
        cost,
        ttl,
        tts,
        successOutcome,
        pendingFind,
        status,
        foundItem,
        createdAtHour);
  }

  public byte[] encodeListing(ListingSnapshot snapshot) {
    final ByteArrayDataOutput out = ByteStreams.newDataOutput();
    out.writeUTF(snapshot.id());
    out.writeUTF(snapshot.searchId());
    out.writeUTF(snapshot.consumerId());
    out.writeUTF(snapshot.tierId());
    out.writeUTF(snapshot.catalogKey());
    out.writeUTF(nullToEmpty(snapshot.displayName()));
    writeItem(out, snapshot.item());
    out.writeInt(snapshot.hoursRemaining());
    out.writeUTF(snapshot.status().value());
    out.writeUTF(snapshot.inspectionState().value());
    out.writeUTF(nullToEmpty(snapshot.inspectionTierId()));
    out.writeLong(snapshot.inspectionCompletesAtHour());
    out.writeInt(snapshot.createdDay());
    return out.toByteArray();
  }

  public ListingSnapshot decodeListing(byte[] payload) {
    final ByteArrayDataInput in = ByteStreams.newDataInput(payload);
    final String id = in.readUTF();
    final String searchId = in.readUTF();
    final String consumerId = in.readUTF();
    final String tierId = in.readUTF();
    final String catalogKey = in.readUTF();
    final String displayName = in.readUTF();
    final FoundItem item = readItem(in);
    final int hoursRemaining = in.readInt();
    final ListingStatus status = ListingStatus.fromValue(in.readUTF());
    final InspectionState inspectionState = InspectionState.fromValue(in.readUTF());
    final String inspectionTierId = in.readUTF();
    final long inspectionCompletesAtHour = in.readLong();
    final int createdDay = in.readInt();
    return new ListingSnapshot(
        id,
        searchId,
        consumerId,
        tierId,
        catalogKey,
        displayName,
        item,
        hoursRemaining,
        status,
        inspectionState,
        inspectionTierId.isEmpty() ? null : inspectionTierId,
        inspectionCompletesAtHour,
        createdDay);
  }

  private void writeOptionalItem(ByteArrayDataOutput out, FoundItem item) {
    out.writeBoolean(item != null);
    if (item != null) {
      writeItem(out, item);
    }
  }

  private FoundItem readOptionalItem(ByteArrayDataInput in) {
    return in.readBoolean() ? readItem(in) : null;
  }

  private void writeItem(ByteArrayDataOutput out, FoundItem item) {
    out.writeDouble(item.condition());
    out.writeLong(item.price());
    writeConfigurations(out, item.matchedConfigurations());
    out.writeInt(item.randomizedConfigurations().size());
    for (String configurationId : item.randomizedConfigurations()) {
      out.writeUTF(configurationId);
    }
  }

  private FoundItem readItem(ByteArrayDataInput in) {
    final double condition = in.readDouble();
    final long price = in.readLong();
    final SortedMap<String, Integer> matched = readConfigurations(in);
    final int randomizedCount = in.readInt();
    final SortedSet<String> randomized = new TreeSet<>();
    for (int i = 0; i < randomizedCount; i++) {
      randomized.add(in.readUTF());
    }
    return new FoundItem(condition, price, matched, randomized);
  }

  private void writeConfigurations(ByteArrayDataOutput out, Map<String, Integer> configurations) {
    out.writeInt(configurations.size());
    for (Map.Entry<String, Integer> entry : new TreeMap<>(configurations).entrySet()) {
      out.writeUTF(entry.getKey());
      out.writeInt(entry.getValue());
    }
  }

  private SortedMap<String, Integer> readConfigurations(ByteArrayDataInput in) {
    final int count = in.readInt();
    final SortedMap<String, Integer> configurations = new TreeMap<>();
    for (int i = 0; i < count; i++) {
      configurations.put(in.readUTF(), in.readInt());
    }
    return configurations;
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
