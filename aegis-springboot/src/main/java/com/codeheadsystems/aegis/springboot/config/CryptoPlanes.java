package com.codeheadsystems.aegis.springboot.config;

import com.codeheadsystems.aegis.crypto.CryptoCore;
import com.codeheadsystems.aegis.crypto.MasterKey;

/**
 * The two independently keyed crypto cores, kept in one bean so neither can be injected where
 * the other belongs.
 *
 * @param secret  protects one-time-password secrets
 * @param data    protects record fields and files
 * @param dataKey data-plane master key, also the root of file token signing
 */
public record CryptoPlanes(CryptoCore secret, CryptoCore data, MasterKey dataKey) {
}
