package com.captainsprep.engine.service.bank;

import com.captainsprep.engine.model.ContentKind;
import com.captainsprep.engine.model.GeneratedItem;

import java.util.List;

/**
 * Long-lived store of approved items.
 */
public interface ContentBank {

    /**
     * Items of {@code kind}, restricted to {@code subject} unless it is {@code null}, in insertion order.
     */
    List<GeneratedItem> listExisting(ContentKind kind, String subject);

    String add(GeneratedItem item);
}
