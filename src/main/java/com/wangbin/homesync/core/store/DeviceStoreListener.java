package com.wangbin.homesync.core.store;

/**
 * 副本变更监听器
 */
@FunctionalInterface
public interface DeviceStoreListener {

    void onStoreChanged(StoreChangeEvent event);
}
