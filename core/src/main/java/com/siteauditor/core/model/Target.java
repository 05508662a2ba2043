package com.siteauditor.core.model;

import java.net.URI;
import java.util.Objects;
import java.util.Optional;

/** 감사 대상: 시드 URL + origin + (옵션) 로그인 설정. 실행 중 불변. */
public final class Target {
    private final URI seed;
    private final Origin origin;
    private final LoginConfig login;

    private Target(URI seed, LoginConfig login) {
        this.seed = Objects.requireNonNull(seed, "seed");
        this.origin = Origin.of(seed);
        this.login = login;
    }

    public static Target of(URI seed) {
        return new Target(seed, null);
    }

    public static Target of(URI seed, LoginConfig login) {
        return new Target(seed, login);
    }

    public URI getSeed() { return seed; }
    public Origin getOrigin() { return origin; }
    public Optional<LoginConfig> getLogin() { return Optional.ofNullable(login); }

    @Override
    public String toString() {
        return "Target{seed=" + seed + ", auth=" + (login != null) + "}";
    }
}
