package com.slb.fleet_backend.modules.asyncreq.service;

/**
 * 可异步执行的操作，按 {@link #operation()} 注册。返回值作为成功响应的 data 写入结果。
 */
public interface AsyncOperationHandler {

    String operation();

    Object handle(String payload);
}
