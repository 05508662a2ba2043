package com.siteauditor.core.api;

import com.siteauditor.core.model.AuthCheckResult;
import com.siteauditor.core.model.LoginConfig;
import com.siteauditor.core.model.Target;

import java.util.List;

/** 인증 플로우 점검 계약. 로그인 설정이 있을 때만 호출된다. */
public interface IAuthTester {
    List<AuthCheckResult> runAuthChecks(Target target, LoginConfig login);
}
