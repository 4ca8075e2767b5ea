package com.wangbin.homesync.core.store;

/**
 * 全量快照拉取开始时领取的凭证，记录当时的增量序号。
 * 应用快照时会回放该序号之后到达的增量，保证"快照 + 此后的增量"顺序。
 *
 * @param id       凭证编号
 * @param patchSeq 领取时最后一个增量的序号
 */
public record SnapshotTicket(long id, long patchSeq) {
}
