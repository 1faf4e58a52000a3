package com.pep.common;

/**
 * 密钥读取接口，每次调用都重新读取，不在请求之间缓存
 */
public interface SecretStore {

    /**
     * @param secretId 密钥标识，例如 anthropic-api-key
     * @return 去除首尾空白后的密钥
     * @throws com.pep.exception.SecretUnavailableException 密钥不存在或为空
     */
    String get(String secretId);
}
