package com.rofexconnector.integration.rofex;

public enum ConnectionState {
  DISCONNECTED,
  CONNECTING,
  CONNECTED
}
