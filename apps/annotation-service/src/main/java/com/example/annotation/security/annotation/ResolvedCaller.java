package com.example.annotation.security.annotation;

import java.lang.annotation.*;

// Inject resolved CallerContext into controller method parameter
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface ResolvedCaller {
}
