package com.slb.fleet_backend.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SwaggerConfig {

    private static final String SECURITY_SCHEME_NAME = "BearerAuth";

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("矿机集群控制服务 API / SLB Fleet Backend API")
                        .version("1.0.0")
                        .description(
                                """
                                1. 基本信息 / Basic Information
                                本服务负责向轮询式矿机（GPU rig / ASIC / 通用设备）下发配置与指令：
                                单设备指令队列、按标签/容器/快照批量下发、异步请求跟踪、超频配置解析以及重复计划任务。
                                This service delivers configuration and commands to polling mining devices: per-device
                                command queues, bulk fan-out by tags/containers/snapshots, async request tracking,
                                overclock resolution and recurring schedules.

                                2. 设备端约定 / Device Protocol
                                - 设备不保持长连接，定期调用 /api/v1/agent/workers/{id}/poll 拉取配置与指令队列。
                                - 指令在设备上报结果（/report）之前一直保留在队列中，重复轮询不会丢失指令。
                                - Devices poll; commands stay queued until the device reports them, so repeated polls are safe.

                                3. 统一返回结构 / Unified Response Envelope
                                - code: 业务状态码，0 表示成功；错误时与 HTTP 状态码一致。
                                - message: 成功为 "ok"，失败为具体原因；error.code 为稳定机器码，error.errors 为字段级明细。
                                - data / traceId: 业务数据与链路追踪 ID。

                                4. 批量操作 / Bulk Operations
                                - 批量下发中单台设备失败不会中断整批，结果按设备逐条返回（status=ok|error）。
                                - 追加 async=true 时返回 202 与 requestId，通过 /api/v1/requests/{requestId} 获取原样回放的结果。
                                """
                        )
                        .contact(new Contact()
                                .name("Hyperion")
                                .email("backend@slb.xyz")
                        )
                )
                .addSecurityItem(new SecurityRequirement().addList(SECURITY_SCHEME_NAME))
                .components(new Components()
                        .addSecuritySchemes(SECURITY_SCHEME_NAME,
                                new SecurityScheme()
                                        .name(SECURITY_SCHEME_NAME)
                                        .type(SecurityScheme.Type.HTTP)
                                        .scheme("bearer")
                                        .bearerFormat("JWT")
                                        .description("在此处输入账户服务签发的 JWT 访问令牌，格式为：Bearer {token}")
                        )
                );
    }
}
