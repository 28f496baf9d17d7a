package com.mk.fx.qa.ws.benchmark.runner;

import java.net.InetAddress;
import java.net.UnknownHostException;

@FunctionalInterface
public interface HostResolver {

  HostResolver SYSTEM = InetAddress::getByName;

  void resolve(String host) throws UnknownHostException;
}
